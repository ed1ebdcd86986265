package com.gillianbc.annuity.service;

import com.gillianbc.annuity.model.FailureKind;
import com.gillianbc.annuity.model.PeriodRecord;
import com.gillianbc.annuity.model.RunSummary;
import com.gillianbc.annuity.model.SimulationRun;
import com.gillianbc.annuity.model.SimulationTrace;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs a principal down month by month: interest is added, then the scheduled withdrawal
 * is taken (clipped to what is left), until the balance drops below one cent.
 * The scheduled withdrawal rises by the annual increase at the start of every 13th, 25th, ... month.
 */
@Slf4j
@Service
public class AmortizationSimulator {

    public static final int CALCULATION_LIMIT_YEARS = 1000;
    public static final double ZERO_BALANCE = 0.01;
    private static final int MONTHS_PER_YEAR = 12;

    /**
     * Converts a nominal annual rate and compounding frequency into the growth rate for one month.
     * <p>
     * periodicRate = (1 + annualRate/100)^(1/compound) - 1, then
     * monthlyRate = (1 + periodicRate)^(compound/12) - 1
     *
     * @param annualRatePercent         nominal annual rate in percent (e.g. 8 for 8%)
     * @param compoundingPeriodsPerYear how often interest is capitalised per year (> 0)
     * @return effective monthly rate as a fraction
     */
    public double effectiveMonthlyRate(double annualRatePercent, int compoundingPeriodsPerYear) {
        if (compoundingPeriodsPerYear <= 0) {
            throw new IllegalArgumentException("compoundingPeriodsPerYear must be > 0");
        }
        double periodicRate = Math.pow(1 + annualRatePercent / 100, 1.0 / compoundingPeriodsPerYear) - 1;
        return Math.pow(1 + periodicRate, compoundingPeriodsPerYear / (double) MONTHS_PER_YEAR) - 1;
    }

    /**
     * Summary-only simulation used inside the solver's objective. Allocates nothing per period.
     * <p>
     * The run is abandoned as diverged once it passes twice the target term.
     *
     * @param termYears target term in years (> 0); bounds the run
     * @return terminal state, or {@link RunSummary#diverged()} if the balance outlived 2 x term
     */
    public RunSummary runFast(double principal,
                              double termYears,
                              double annualRatePercent,
                              int compoundingPeriodsPerYear,
                              double initialWithdrawal,
                              double annualIncreasePercent) {
        double monthlyRate = effectiveMonthlyRate(annualRatePercent, compoundingPeriodsPerYear);
        double increaseFactor = 1 + annualIncreasePercent / 100;
        double limit = 2 * termYears * MONTHS_PER_YEAR;

        double balance = principal;
        double scheduled = initialWithdrawal;
        double lastWithdrawal = 0;

        int i = 0;
        while (balance >= ZERO_BALANCE) {
            if (i > 0 && i % MONTHS_PER_YEAR == 0) {
                scheduled *= increaseFactor;
            }
            if (i > limit) {
                return RunSummary.diverged();
            }

            balance += balance * monthlyRate;

            double withdrawal = Math.min(balance, scheduled);
            balance -= withdrawal;
            lastWithdrawal = withdrawal;

            i++;
        }

        return new RunSummary(i / (double) MONTHS_PER_YEAR, scheduled, lastWithdrawal);
    }

    /**
     * Full simulation keeping every period.
     * <p>
     * With a target term the run is abandoned as {@link FailureKind#SEARCH_FAILED} past twice that term.
     * Without one (open-ended) it is abandoned as {@link FailureKind#CALCULATION_TOO_LONG}
     * past {@value #CALCULATION_LIMIT_YEARS} years.
     *
     * @param termYears target term in years, or null to run until the balance is exhausted
     */
    public SimulationRun runFull(double principal,
                                 Double termYears,
                                 double annualRatePercent,
                                 int compoundingPeriodsPerYear,
                                 double initialWithdrawal,
                                 double annualIncreasePercent) {
        double monthlyRate = effectiveMonthlyRate(annualRatePercent, compoundingPeriodsPerYear);
        double increaseFactor = 1 + annualIncreasePercent / 100;
        boolean openEnded = termYears == null;
        double limit = openEnded
                ? CALCULATION_LIMIT_YEARS * MONTHS_PER_YEAR
                : 2 * termYears * MONTHS_PER_YEAR;

        List<PeriodRecord> periods = new ArrayList<>();
        double balance = principal;
        double scheduled = initialWithdrawal;

        int i = 0;
        while (balance >= ZERO_BALANCE) {
            if (i > 0 && i % MONTHS_PER_YEAR == 0) {
                scheduled *= increaseFactor;
            }
            if (i > limit) {
                FailureKind failure = openEnded ? FailureKind.CALCULATION_TOO_LONG : FailureKind.SEARCH_FAILED;
                log.debug("Simulation abandoned after {} periods: {}", i, failure);
                return SimulationRun.abandoned(failure);
            }

            double startBalance = balance;

            double interestPayment = balance * monthlyRate;
            balance += interestPayment;

            double withdrawal = Math.min(balance, scheduled);
            balance -= withdrawal;

            periods.add(new PeriodRecord(i + 1, startBalance, balance, interestPayment, withdrawal));

            i++;
        }

        return SimulationRun.completed(new SimulationTrace(periods, scheduled));
    }
}
