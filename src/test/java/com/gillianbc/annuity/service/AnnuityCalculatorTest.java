package com.gillianbc.annuity.service;

import com.gillianbc.annuity.model.PolicyKind;
import com.gillianbc.annuity.model.SimulationInput;
import com.gillianbc.annuity.model.SolveResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AnnuityCalculatorTest {

    private final AmortizationSimulator simulator = new AmortizationSimulator();
    private final ParameterSolver solver = new ParameterSolver();
    private final ResultAggregator aggregator = new ResultAggregator();

    private final AnnuityCalculator calculator = new AnnuityCalculator(List.of(
            new WithdrawalPolicy(simulator, solver, aggregator),
            new TermPolicy(simulator, solver, aggregator),
            new PrincipalPolicy(simulator, solver, aggregator),
            new RatePolicy(simulator, solver, aggregator)));

    private final SimulationInput complete = SimulationInput.builder()
            .principal(120_000.0)
            .termYears(10.0)
            .annualRatePercent(0.0)
            .initialMonthlyWithdrawal(1000.0)
            .annualIncreasePercent(0.0)
            .build();

    @Test
    @DisplayName("Each kind is routed to the policy that solves for it")
    void solve_dispatchesOnKind() {
        for (PolicyKind kind : PolicyKind.values()) {
            SolveResult result = calculator.solve(complete, kind);
            assertTrue(result.isSolved(), kind + " was not solved");
            assertEquals(kind, result.getSolution().orElseThrow().getKind());
        }
    }

    @Test
    @DisplayName("Zero-interest inputs solve back to themselves for every kind")
    void solve_zeroInterest_consistentAcrossKinds() {
        assertEquals(1000.0, solvedValue(PolicyKind.WITHDRAWAL), 1e-9);
        assertEquals(10.0, solvedValue(PolicyKind.TERM), 0.0);
        assertEquals(120_000.0, solvedValue(PolicyKind.PRINCIPAL), 0.01);
    }

    @Test
    @DisplayName("Missing input surfaces as MissingInputException")
    void solve_missingInput_throws() {
        SimulationInput input = complete.toBuilder().principal(null).build();
        assertThrows(MissingInputException.class, () -> calculator.solve(input, PolicyKind.TERM));
    }

    @Test
    @DisplayName("Null kind throws NullPointerException")
    void solve_nullKind_throwsNPE() {
        assertThrows(NullPointerException.class, () -> calculator.solve(complete, null));
    }

    @Test
    @DisplayName("Every kind needs exactly one policy")
    void constructor_rejectsMissingOrDuplicatePolicies() {
        assertThrows(IllegalStateException.class, () -> new AnnuityCalculator(List.of(
                new WithdrawalPolicy(simulator, solver, aggregator))));
        assertThrows(IllegalStateException.class, () -> new AnnuityCalculator(List.of(
                new WithdrawalPolicy(simulator, solver, aggregator),
                new WithdrawalPolicy(simulator, solver, aggregator),
                new TermPolicy(simulator, solver, aggregator),
                new PrincipalPolicy(simulator, solver, aggregator),
                new RatePolicy(simulator, solver, aggregator))));
    }

    private double solvedValue(PolicyKind kind) {
        return calculator.solve(complete, kind).getSolution().orElseThrow().getSummary().getSolvedValue();
    }
}
