package com.lesson.reconciliation.source;

/**
 * Thrown when lessons cannot be loaded from a source.
 */
public class LessonSourceException extends RuntimeException {

    public LessonSourceException(String message) {
        super(message);
    }

    public LessonSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
