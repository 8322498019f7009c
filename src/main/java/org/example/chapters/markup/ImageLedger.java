package org.example.chapters.markup;

import org.example.chapters.model.ImageRef;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Chapter-wide list of images in first-seen order, one entry per URL.
 * Dimensions recorded first are kept; later references only fill gaps.
 */
public class ImageLedger {

    private final Map<String, ImageRef> images = new LinkedHashMap<>();

    public ImageRef register(ImageRef ref) {
        return images.merge(ref.url(), ref, ImageRef::fillMissing);
    }

    public List<ImageRef> images() {
        return new ArrayList<>(images.values());
    }

    public List<String> urls() {
        return new ArrayList<>(images.keySet());
    }

    public int size() {
        return images.size();
    }
}
