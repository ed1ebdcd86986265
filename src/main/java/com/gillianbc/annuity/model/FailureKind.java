package com.gillianbc.annuity.model;

/**
 * Recoverable reasons a solve produced no answer.
 */
public enum FailureKind {
    /** The search ran out of tolerance tiers and restarts, or settled on a negative value. */
    SEARCH_FAILED,
    /** An open-ended simulation kept paying out beyond the 1000 year ceiling. */
    CALCULATION_TOO_LONG
}
