package org.example.chapters.model;

import java.util.List;

/**
 * Where a single image is used inside one question. Context tags are
 * {@code question}, {@code analysis} or {@code choice:<label>}.
 */
public record ImageUsage(
    String url,
    String width,
    String height,
    String file,
    List<String> contexts
) {}
