package org.example.chapters.markup;

import org.example.chapters.model.ImageRef;
import org.example.chapters.model.RichPart;
import org.example.chapters.model.TextSegment;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Helpers for ordered text/image sequences.
 */
public final class RichParts {

    public static final String IMAGE_PLACEHOLDER = "[图%d]";

    private RichParts() {
    }

    static void rewrite(List<RichPart> parts, UnaryOperator<String> rewriter) {
        parts.replaceAll(part -> part instanceof TextSegment segment
            ? new TextSegment(rewriter.apply(segment.text()))
            : part);
    }

    /**
     * Joins the parts with single spaces, writing the N-th image of the
     * sequence as {@code [图N]}. Empty text parts are skipped.
     */
    public static String withPlaceholders(List<RichPart> parts) {
        StringBuilder joined = new StringBuilder();
        int imageIndex = 0;
        for (RichPart part : parts) {
            String piece;
            if (part instanceof ImageRef) {
                imageIndex++;
                piece = String.format(IMAGE_PLACEHOLDER, imageIndex);
            } else if (part instanceof TextSegment segment) {
                piece = segment.text();
            } else {
                continue;
            }
            if (piece == null || piece.isEmpty()) {
                continue;
            }
            if (joined.length() > 0) {
                joined.append(' ');
            }
            joined.append(piece);
        }
        return joined.toString().strip();
    }
}
