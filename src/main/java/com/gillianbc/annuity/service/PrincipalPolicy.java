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
 * Finds the starting principal that funds the withdrawals for exactly the target term.
 * The withdrawal itself is both the first trial principal and the first step. Rounded down to the cent.
 */
@Component
public class PrincipalPolicy extends AbstractSolverPolicy {

    public PrincipalPolicy(AmortizationSimulator simulator, ParameterSolver solver, ResultAggregator aggregator) {
        super(simulator, solver, aggregator);
    }

    @Override
    public PolicyKind kind() {
        return PolicyKind.PRINCIPAL;
    }

    @Override
    protected SolveResult solveUnknown(SimulationInput input) {
        double term = input.getTermYears();
        double rate = input.getAnnualRatePercent();
        int compound = input.getCompoundingPeriodsPerYear();
        double withdrawal = input.getInitialMonthlyWithdrawal();
        double increase = input.getAnnualIncreasePercent();

        OptionalDouble principal = solver.findMoneyParameter(p -> {
            RunSummary run = simulator.runFast(p, term, rate, compound, withdrawal, increase);
            return shortfallRatio(run.getFinalScheduledWithdrawal(), run.getFinalAppliedWithdrawal(),
                    run.getActualTermYears(), term);
        }, SearchDirection.INCREASING, withdrawal, withdrawal);

        if (principal.isEmpty()) {
            return SolveResult.failed(FailureKind.SEARCH_FAILED);
        }
        SimulationInput resolved = input.toBuilder()
                .principal(principal.getAsDouble())
                .build();
        return complete(resolved, principal.getAsDouble());
    }
}
