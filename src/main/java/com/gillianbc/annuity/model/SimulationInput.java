package com.gillianbc.annuity.model;

import lombok.Builder;
import lombok.Getter;

/**
 * Inputs to an annuity calculation. Any field left null is either the unknown being solved for
 * or, for the term, means the simulation runs until the balance is exhausted.
 */
@Getter
@Builder(toBuilder = true)
public class SimulationInput {

    private final Double principal;
    private final Double termYears;
    private final Double annualRatePercent;
    @Builder.Default
    private final int compoundingPeriodsPerYear = 12;
    private final Double initialMonthlyWithdrawal;
    /** Applied to the scheduled withdrawal every 12 periods, compounding. */
    private final Double annualIncreasePercent;
}
