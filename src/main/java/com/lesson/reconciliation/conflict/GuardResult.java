package com.lesson.reconciliation.conflict;

/**
 * Outcome of a conflict check.
 *
 * @param blocked true if the alignment must not proceed
 * @param reason  user-facing explanation when blocked, otherwise null
 */
public record GuardResult(boolean blocked, String reason) {

    private static final GuardResult CLEAR = new GuardResult(false, null);

    public static GuardResult clear() {
        return CLEAR;
    }

    public static GuardResult blocked(String reason) {
        return new GuardResult(true, reason);
    }

    public boolean isClear() {
        return !blocked;
    }
}
