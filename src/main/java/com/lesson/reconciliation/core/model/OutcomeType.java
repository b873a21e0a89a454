package com.lesson.reconciliation.core.model;

/**
 * The four disjoint classifications a reconciliation run assigns.
 */
public enum OutcomeType {
    MATCHED,
    MISMATCHED,
    MISSING_IN_DB,
    MISSING_IN_SHEET
}
