package com.gillianbc.annuity.service;

import com.gillianbc.annuity.model.AnnualRecord;
import com.gillianbc.annuity.model.AnnuitySolution;
import com.gillianbc.annuity.model.FailureKind;
import com.gillianbc.annuity.model.InputField;
import com.gillianbc.annuity.model.SimulationInput;
import com.gillianbc.annuity.model.SimulationRun;
import com.gillianbc.annuity.model.SimulationTrace;
import com.gillianbc.annuity.model.SolveResult;
import com.gillianbc.annuity.model.SolveSummary;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Shared steps for every policy: checking the required inputs are present, then re-running the
 * simulation in full with the solved value and summarising the trajectory.
 */
@Slf4j
public abstract class AbstractSolverPolicy implements SolverPolicy {

    protected final AmortizationSimulator simulator;
    protected final ParameterSolver solver;
    protected final ResultAggregator aggregator;

    protected AbstractSolverPolicy(AmortizationSimulator simulator, ParameterSolver solver, ResultAggregator aggregator) {
        this.simulator = Objects.requireNonNull(simulator, "simulator must not be null");
        this.solver = Objects.requireNonNull(solver, "solver must not be null");
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator must not be null");
    }

    @Override
    public final SolveResult solve(SimulationInput input) {
        Objects.requireNonNull(input, "input must not be null");
        requirePresent(input);
        SolveResult result = solveUnknown(input);
        if (!result.isSolved()) {
            log.warn("Solving for {} failed: {}", kind(), result.getFailure().orElseThrow());
        }
        return result;
    }

    /**
     * Solves for the unknown. Called only once every required field is known to be non-null.
     */
    protected abstract SolveResult solveUnknown(SimulationInput input);

    /**
     * Runs the full simulation for inputs that are now complete and packages the result.
     *
     * @param resolved    inputs with the unknown filled in; a null term means open-ended
     * @param solvedValue value reported as the answer
     */
    protected SolveResult complete(SimulationInput resolved, double solvedValue) {
        SimulationRun run = simulator.runFull(
                resolved.getPrincipal(),
                resolved.getTermYears(),
                resolved.getAnnualRatePercent(),
                resolved.getCompoundingPeriodsPerYear(),
                resolved.getInitialMonthlyWithdrawal(),
                resolved.getAnnualIncreasePercent());
        if (!run.isCompleted()) {
            return SolveResult.failed(run.getFailure().orElseThrow());
        }
        return summarise(resolved, run.getTrace().orElseThrow(), solvedValue);
    }

    protected SolveResult summarise(SimulationInput resolved, SimulationTrace trace, double solvedValue) {
        if (trace.periodCount() == 0) {
            // A principal under one cent pays nothing out
            return SolveResult.failed(FailureKind.SEARCH_FAILED);
        }
        List<AnnualRecord> annual = aggregator.toAnnual(trace);

        double principal = resolved.getPrincipal();
        double initialAnnualIncome = resolved.getInitialMonthlyWithdrawal() * Math.min(12, trace.periodCount());
        double drawDownPercent = initialAnnualIncome / Math.max(principal, initialAnnualIncome) * 100;

        SolveSummary summary = new SolveSummary(
                trace.totalInterest(),
                trace.totalWithdrawn(),
                initialAnnualIncome,
                drawDownPercent,
                solvedValue);

        log.info("Solved {} = {} over {} periods (total withdrawn {}, total interest {})",
                kind().unknown().fieldName(), solvedValue, trace.periodCount(),
                String.format("%.2f", summary.getTotalWithdrawn()), String.format("%.2f", summary.getTotalInterest()));

        return SolveResult.solved(new AnnuitySolution(kind(), resolved, trace, annual, summary));
    }

    /**
     * Ratio used by the principal and rate searches: scheduled / applied withdrawal once the term
     * matches, otherwise target term / actual term.
     */
    protected double shortfallRatio(double scheduled, double applied, double actualTermYears, double targetTermYears) {
        if (actualTermYears == targetTermYears) {
            return scheduled / applied;
        }
        return targetTermYears / actualTermYears;
    }

    private void requirePresent(SimulationInput input) {
        List<String> missing = new ArrayList<>();
        for (InputField field : kind().requiredFields()) {
            if (field.valueOf(input) == null) {
                missing.add(field.fieldName());
            }
        }
        if (!missing.isEmpty()) {
            throw new MissingInputException(kind(), missing);
        }
    }
}
