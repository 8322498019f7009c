package org.example.chapters.model;

public record TextItem(String text) implements ChapterItem {
}
