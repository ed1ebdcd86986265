package com.gillianbc.annuity.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a solve: either a solution or the kind of failure. Never both.
 */
public final class SolveResult {

    private final AnnuitySolution solution;
    private final FailureKind failure;

    private SolveResult(AnnuitySolution solution, FailureKind failure) {
        this.solution = solution;
        this.failure = failure;
    }

    public static SolveResult solved(AnnuitySolution solution) {
        return new SolveResult(Objects.requireNonNull(solution, "solution must not be null"), null);
    }

    public static SolveResult failed(FailureKind failure) {
        return new SolveResult(null, Objects.requireNonNull(failure, "failure must not be null"));
    }

    public boolean isSolved() {
        return solution != null;
    }

    public Optional<AnnuitySolution> getSolution() {
        return Optional.ofNullable(solution);
    }

    public Optional<FailureKind> getFailure() {
        return Optional.ofNullable(failure);
    }

    @Override
    public String toString() {
        return isSolved() ? "SolveResult[solved " + solution.getKind() + "]" : "SolveResult[" + failure + "]";
    }
}
