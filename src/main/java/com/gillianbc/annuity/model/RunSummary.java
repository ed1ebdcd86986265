package com.gillianbc.annuity.model;

import lombok.Getter;

/**
 * Terminal state of a fast (summary-only) simulation run.
 * A diverged run reports an infinite term and zero withdrawals.
 */
@Getter
public class RunSummary {

    private static final RunSummary DIVERGED = new RunSummary(Double.POSITIVE_INFINITY, 0, 0);

    private final double actualTermYears;
    private final double finalScheduledWithdrawal;
    /** The last period's withdrawal after clipping to the available balance. */
    private final double finalAppliedWithdrawal;

    public RunSummary(double actualTermYears, double finalScheduledWithdrawal, double finalAppliedWithdrawal) {
        this.actualTermYears = actualTermYears;
        this.finalScheduledWithdrawal = finalScheduledWithdrawal;
        this.finalAppliedWithdrawal = finalAppliedWithdrawal;
    }

    public static RunSummary diverged() {
        return DIVERGED;
    }

    public boolean isDiverged() {
        return Double.isInfinite(actualTermYears);
    }
}
