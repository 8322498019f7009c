package org.example.chapters.model;

/**
 * Reference to an inline image in the source markup. Two references denote
 * the same image when their URLs are equal; dimensions are kept as the raw
 * attribute values.
 */
public record ImageRef(
    String url,
    String width,   // nullable
    String height   // nullable
) implements RichPart {

    /**
     * Returns a copy whose missing dimensions are taken from {@code other}.
     */
    public ImageRef fillMissing(ImageRef other) {
        if (other == null) {
            return this;
        }
        String mergedWidth = isBlank(width) ? other.width() : width;
        String mergedHeight = isBlank(height) ? other.height() : height;
        return new ImageRef(url, mergedWidth, mergedHeight);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
