package org.example.chapters.model;

import java.util.List;

public record Chapter(
    String id,
    String title,
    List<Section> sections,
    List<ChapterImage> images
) {}
