package org.example.chapters.model;

/**
 * An image that appeared outside of any question.
 */
public record ImageItem(ImageRef image) implements ChapterItem {
}
