package com.gillianbc.annuity.service;

import com.gillianbc.annuity.model.PolicyKind;
import com.gillianbc.annuity.model.SimulationInput;
import com.gillianbc.annuity.model.SolveResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Single entry point for all four calculations. Picks the policy for the requested unknown.
 */
@Slf4j
@Service
public class AnnuityCalculator {

    private final Map<PolicyKind, SolverPolicy> policies = new EnumMap<>(PolicyKind.class);

    public AnnuityCalculator(List<SolverPolicy> policies) {
        for (SolverPolicy policy : policies) {
            SolverPolicy previous = this.policies.put(policy.kind(), policy);
            if (previous != null) {
                throw new IllegalStateException("Duplicate solver policy for " + policy.kind());
            }
        }
        for (PolicyKind kind : PolicyKind.values()) {
            if (!this.policies.containsKey(kind)) {
                throw new IllegalStateException("No solver policy registered for " + kind);
            }
        }
    }

    /**
     * @param input inputs with every field except the unknown present
     * @param kind  which parameter to solve for
     * @return the solution, or the kind of failure
     * @throws MissingInputException if a field the policy needs is null
     */
    public SolveResult solve(SimulationInput input, PolicyKind kind) {
        Objects.requireNonNull(input, "input must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        log.debug("Solving for {}", kind);
        return policies.get(kind).solve(input);
    }
}
