package org.example.chapters.model;

public record ChapterImage(
    String url,
    String width,
    String height,
    String file     // null when the image was not downloaded
) {}
