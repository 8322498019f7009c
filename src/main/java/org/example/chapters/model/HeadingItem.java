package org.example.chapters.model;

public record HeadingItem(int level, String text) implements ChapterItem {
}
