package com.lesson.reconciliation.align;

import com.lesson.reconciliation.core.model.DbLesson;

import java.util.Objects;

/**
 * Result of an alignment.
 *
 * @param status        whether the lesson was written, blocked by a scheduling conflict, or failed
 * @param message       user-facing outcome message
 * @param updatedLesson the lesson as stored after the write; null unless applied
 */
public record ApplyResult(Status status, String message, DbLesson updatedLesson) {

    public enum Status {
        APPLIED,
        /** Refused because it would double-book the teacher or the student. */
        BLOCKED,
        FAILED
    }

    public ApplyResult {
        Objects.requireNonNull(status, "status is required");
    }

    public static ApplyResult success(DbLesson updatedLesson) {
        return new ApplyResult(Status.APPLIED, "Lesson successfully aligned with the sheet", updatedLesson);
    }

    public static ApplyResult blocked(String reason) {
        return new ApplyResult(Status.BLOCKED, reason, null);
    }

    public static ApplyResult failure(String message) {
        return new ApplyResult(Status.FAILED, message, null);
    }

    public boolean success() {
        return status == Status.APPLIED;
    }

    public boolean isBlocked() {
        return status == Status.BLOCKED;
    }

    public boolean isFailure() {
        return status != Status.APPLIED;
    }
}
