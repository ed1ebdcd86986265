package com.gillianbc.annuity.model;

import lombok.Getter;

/**
 * Immutable value representing one compounding period (month) of a simulation,
 * with the balance at the start and end of that period.
 * <p>
 * endBalance = startBalance + interestPayment - withdrawal
 */
@Getter
public class PeriodRecord {

    /** 1-based month number within the simulation. */
    private final int period;
    private final double startBalance;
    private final double endBalance;
    private final double interestPayment;
    /** Amount actually withdrawn, clipped to the available balance on the final period. */
    private final double withdrawal;

    public PeriodRecord(int period,
                        double startBalance,
                        double endBalance,
                        double interestPayment,
                        double withdrawal) {
        if (period < 1) {
            throw new IllegalArgumentException("period must be >= 1");
        }
        if (endBalance < 0) {
            throw new IllegalArgumentException("endBalance must be >= 0");
        }
        this.period = period;
        this.startBalance = startBalance;
        this.endBalance = endBalance;
        this.interestPayment = interestPayment;
        this.withdrawal = withdrawal;
    }

    /**
     * @return 1-based year this period falls in
     */
    public int year() {
        return (period - 1) / 12 + 1;
    }
}
