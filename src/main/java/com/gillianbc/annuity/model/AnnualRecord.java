package com.gillianbc.annuity.model;

import lombok.Getter;

/**
 * Immutable value summarising one year (up to 12 periods) of a simulation,
 * including running totals since the first period.
 */
@Getter
public class AnnualRecord {

    private final int year;
    private final double startBalance;
    private final double endBalance;
    /** Interest earned within this year. */
    private final double interestPayment;
    /** Amount withdrawn within this year. */
    private final double withdrawal;
    private final double totalInterest;
    private final double totalWithdrawn;

    public AnnualRecord(int year,
                        double startBalance,
                        double endBalance,
                        double interestPayment,
                        double withdrawal,
                        double totalInterest,
                        double totalWithdrawn) {
        if (year < 1) {
            throw new IllegalArgumentException("year must be >= 1");
        }
        this.year = year;
        this.startBalance = startBalance;
        this.endBalance = endBalance;
        this.interestPayment = interestPayment;
        this.withdrawal = withdrawal;
        this.totalInterest = totalInterest;
        this.totalWithdrawn = totalWithdrawn;
    }
}
