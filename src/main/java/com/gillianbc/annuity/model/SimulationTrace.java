package com.gillianbc.annuity.model;

import lombok.Getter;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Complete period-by-period trajectory of one simulation run, in chronological order.
 */
@Getter
public class SimulationTrace {

    private final List<PeriodRecord> periods;
    /** Scheduled monthly withdrawal in effect when the balance ran out, after annual increases. */
    private final double finalScheduledWithdrawal;

    public SimulationTrace(List<PeriodRecord> periods, double finalScheduledWithdrawal) {
        this.periods = Collections.unmodifiableList(Objects.requireNonNull(periods, "periods must not be null"));
        this.finalScheduledWithdrawal = finalScheduledWithdrawal;
    }

    public int periodCount() {
        return periods.size();
    }

    public double actualTermYears() {
        return periods.size() / 12.0;
    }

    public double totalInterest() {
        double total = 0;
        for (PeriodRecord p : periods) {
            total += p.getInterestPayment();
        }
        return total;
    }

    public double totalWithdrawn() {
        double total = 0;
        for (PeriodRecord p : periods) {
            total += p.getWithdrawal();
        }
        return total;
    }
}
