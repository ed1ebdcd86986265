package com.gillianbc.annuity.service;

import com.gillianbc.annuity.model.AnnualRecord;
import com.gillianbc.annuity.model.PeriodRecord;
import com.gillianbc.annuity.model.SimulationTrace;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Rolls a monthly trace up into one record per year of 12 periods. The last year may be shorter.
 */
@Service
public class ResultAggregator {

    private static final int MONTHS_PER_YEAR = 12;

    public List<AnnualRecord> toAnnual(SimulationTrace trace) {
        Objects.requireNonNull(trace, "trace must not be null");

        List<PeriodRecord> periods = trace.getPeriods();
        List<AnnualRecord> annual = new ArrayList<>((periods.size() + MONTHS_PER_YEAR - 1) / MONTHS_PER_YEAR);

        double totalInterest = 0;
        double totalWithdrawn = 0;
        double yearInterest = 0;
        double yearWithdrawn = 0;
        double yearStartBalance = 0;

        for (int idx = 0; idx < periods.size(); idx++) {
            PeriodRecord p = periods.get(idx);
            if (idx % MONTHS_PER_YEAR == 0) {
                yearStartBalance = p.getStartBalance();
            }
            totalInterest += p.getInterestPayment();
            totalWithdrawn += p.getWithdrawal();
            yearInterest += p.getInterestPayment();
            yearWithdrawn += p.getWithdrawal();

            // Close the year on every 12th period and on the final one
            if ((idx + 1) % MONTHS_PER_YEAR == 0 || idx + 1 == periods.size()) {
                annual.add(new AnnualRecord(
                        annual.size() + 1,
                        yearStartBalance,
                        p.getEndBalance(),
                        yearInterest,
                        yearWithdrawn,
                        totalInterest,
                        totalWithdrawn));
                yearInterest = 0;
                yearWithdrawn = 0;
            }
        }

        return annual;
    }
}
