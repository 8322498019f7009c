package org.example.chapters.markup;

/**
 * Thrown when a chapter document cannot be parsed at all. Unknown or
 * ambiguous nodes inside an otherwise readable document never cause this.
 */
public class ChapterParseException extends RuntimeException {

    public ChapterParseException(String message) {
        super(message);
    }

    public ChapterParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
