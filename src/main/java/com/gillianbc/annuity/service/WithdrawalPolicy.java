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
 * Finds the initial monthly withdrawal that runs the principal down in exactly the target term.
 * <p>
 * The search starts at the first month's interest and moves in steps of 100. The result is rounded
 * up to the cent.
 */
@Component
public class WithdrawalPolicy extends AbstractSolverPolicy {

    static final double INITIAL_STEP = 100;

    public WithdrawalPolicy(AmortizationSimulator simulator, ParameterSolver solver, ResultAggregator aggregator) {
        super(simulator, solver, aggregator);
    }

    @Override
    public PolicyKind kind() {
        return PolicyKind.WITHDRAWAL;
    }

    @Override
    protected SolveResult solveUnknown(SimulationInput input) {
        double principal = input.getPrincipal();
        double term = input.getTermYears();
        double rate = input.getAnnualRatePercent();
        int compound = input.getCompoundingPeriodsPerYear();
        double increase = input.getAnnualIncreasePercent();

        double firstInterestPayment = principal * simulator.effectiveMonthlyRate(rate, compound);

        OptionalDouble withdrawal = solver.findMoneyParameter(w -> {
            RunSummary run = simulator.runFast(principal, term, rate, compound, w, increase);
            if (run.getActualTermYears() == term) {
                return run.getFinalAppliedWithdrawal() / run.getFinalScheduledWithdrawal();
            }
            return run.getActualTermYears() / term;
        }, SearchDirection.DECREASING, INITIAL_STEP, firstInterestPayment);

        if (withdrawal.isEmpty()) {
            return SolveResult.failed(FailureKind.SEARCH_FAILED);
        }
        SimulationInput resolved = input.toBuilder()
                .initialMonthlyWithdrawal(withdrawal.getAsDouble())
                .build();
        return complete(resolved, withdrawal.getAsDouble());
    }
}
