package com.gillianbc.annuity.service;

import com.gillianbc.annuity.model.FailureKind;
import com.gillianbc.annuity.model.PolicyKind;
import com.gillianbc.annuity.model.RunSummary;
import com.gillianbc.annuity.model.SearchDirection;
import com.gillianbc.annuity.model.SimulationInput;
import com.gillianbc.annuity.model.SolveResult;
import org.springframework.stereotype.Component;

import java.util.OptionalDouble;

/**
 * Finds the nominal annual rate at which the principal funds the withdrawals for exactly the target term.
 * Searches from 0% in steps of 1%, then rounds down to 3 decimal places before the final run.
 */
@Component
public class RatePolicy extends AbstractSolverPolicy {

    static final double INITIAL_STEP = 1;
    static final double INITIAL_RATE = 0;
    static final int RATE_DECIMALS = 3;

    public RatePolicy(AmortizationSimulator simulator, ParameterSolver solver, ResultAggregator aggregator) {
        super(simulator, solver, aggregator);
    }

    @Override
    public PolicyKind kind() {
        return PolicyKind.RATE;
    }

    @Override
    protected SolveResult solveUnknown(SimulationInput input) {
        double principal = input.getPrincipal();
        double term = input.getTermYears();
        int compound = input.getCompoundingPeriodsPerYear();
        double withdrawal = input.getInitialMonthlyWithdrawal();
        double increase = input.getAnnualIncreasePercent();

        OptionalDouble rate = solver.find(r -> {
            RunSummary run = simulator.runFast(principal, term, r, compound, withdrawal, increase);
            return shortfallRatio(run.getFinalScheduledWithdrawal(), run.getFinalAppliedWithdrawal(),
                    run.getActualTermYears(), term);
        }, SearchDirection.INCREASING, INITIAL_STEP, INITIAL_RATE);

        if (rate.isEmpty()) {
            return SolveResult.failed(FailureKind.SEARCH_FAILED);
        }
        double rounded = ParameterSolver.roundDown(rate.getAsDouble(), RATE_DECIMALS);
        SimulationInput resolved = input.toBuilder()
                .annualRatePercent(rounded)
                .build();
        return complete(resolved, rounded);
    }
}
