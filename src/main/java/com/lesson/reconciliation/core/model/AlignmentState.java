package com.lesson.reconciliation.core.model;

import java.util.Objects;

/**
 * Transient state of an alignment attempt for one DB lesson.
 *
 * @param status the attempt status
 * @param reason why the attempt was blocked or failed; null while pending
 */
public record AlignmentState(Status status, String reason) {

    public enum Status {
        PENDING,
        BLOCKED,
        FAILED
    }

    public AlignmentState {
        Objects.requireNonNull(status, "status is required");
    }

    public static AlignmentState pending() {
        return new AlignmentState(Status.PENDING, null);
    }

    public static AlignmentState blocked(String reason) {
        return new AlignmentState(Status.BLOCKED, reason);
    }

    public static AlignmentState failed(String reason) {
        return new AlignmentState(Status.FAILED, reason);
    }

    public boolean isPending() {
        return status == Status.PENDING;
    }
}
