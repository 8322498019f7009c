package org.example.chapters.model;

import java.util.List;

public record Section(
    String title,   // nullable
    List<ChapterItem> items
) {}
