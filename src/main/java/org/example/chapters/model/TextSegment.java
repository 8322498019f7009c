package org.example.chapters.model;

public record TextSegment(String text) implements RichPart {
}
