package com.lesson.reconciliation.store;

import java.util.Objects;

/**
 * Id and display name of a teacher or subject resolved from the store.
 */
public record NamedRef(String id, String name) {
    public NamedRef {
        Objects.requireNonNull(id, "id is required");
    }
}
