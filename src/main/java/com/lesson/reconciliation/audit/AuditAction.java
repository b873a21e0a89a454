package com.lesson.reconciliation.audit;

/**
 * Types of auditable actions taken by the reconciler.
 */
public enum AuditAction {
    RECONCILIATION_COMPLETED,
    ALIGNMENT_REQUESTED,
    ALIGNMENT_APPLIED,
    ALIGNMENT_BLOCKED,
    ALIGNMENT_FAILED
}
