package com.gillianbc.annuity.model;

import lombok.Getter;

@Getter
public class SolveSummary {

    private final double totalInterest;
    private final double totalWithdrawn;
    /** First-year income: the initial monthly withdrawal times min(12, periods). */
    private final double initialAnnualIncome;
    private final double drawDownPercent;
    /** The value found for the unknown parameter. */
    private final double solvedValue;

    public SolveSummary(double totalInterest,
                        double totalWithdrawn,
                        double initialAnnualIncome,
                        double drawDownPercent,
                        double solvedValue) {
        this.totalInterest = totalInterest;
        this.totalWithdrawn = totalWithdrawn;
        this.initialAnnualIncome = initialAnnualIncome;
        this.drawDownPercent = drawDownPercent;
        this.solvedValue = solvedValue;
    }
}
