package com.gillianbc.annuity.service;

import com.gillianbc.annuity.model.PolicyKind;
import com.gillianbc.annuity.model.SimulationInput;
import com.gillianbc.annuity.model.SimulationRun;
import com.gillianbc.annuity.model.SimulationTrace;
import com.gillianbc.annuity.model.SolveResult;
import org.springframework.stereotype.Component;

/**
 * Reads the term straight off an open-ended simulation: no search is needed.
 * Fails with CALCULATION_TOO_LONG if the balance lasts beyond the 1000 year ceiling.
 */
@Component
public class TermPolicy extends AbstractSolverPolicy {

    public TermPolicy(AmortizationSimulator simulator, ParameterSolver solver, ResultAggregator aggregator) {
        super(simulator, solver, aggregator);
    }

    @Override
    public PolicyKind kind() {
        return PolicyKind.TERM;
    }

    @Override
    protected SolveResult solveUnknown(SimulationInput input) {
        SimulationRun run = simulator.runFull(
                input.getPrincipal(),
                null,
                input.getAnnualRatePercent(),
                input.getCompoundingPeriodsPerYear(),
                input.getInitialMonthlyWithdrawal(),
                input.getAnnualIncreasePercent());
        if (!run.isCompleted()) {
            return SolveResult.failed(run.getFailure().orElseThrow());
        }
        SimulationTrace trace = run.getTrace().orElseThrow();
        double term = trace.actualTermYears();
        SimulationInput resolved = input.toBuilder()
                .termYears(term)
                .build();
        return summarise(resolved, trace, term);
    }
}
