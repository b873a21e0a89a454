package com.lesson.reconciliation.store;

/**
 * Thrown by {@link LessonStore} implementations when the backing store cannot be read or written.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
