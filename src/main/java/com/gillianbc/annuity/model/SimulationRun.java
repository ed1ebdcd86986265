package com.gillianbc.annuity.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a full-trace simulation: the trace, or why it was abandoned.
 */
public final class SimulationRun {

    private final SimulationTrace trace;
    private final FailureKind failure;

    private SimulationRun(SimulationTrace trace, FailureKind failure) {
        this.trace = trace;
        this.failure = failure;
    }

    public static SimulationRun completed(SimulationTrace trace) {
        return new SimulationRun(Objects.requireNonNull(trace, "trace must not be null"), null);
    }

    public static SimulationRun abandoned(FailureKind failure) {
        return new SimulationRun(null, Objects.requireNonNull(failure, "failure must not be null"));
    }

    public boolean isCompleted() {
        return trace != null;
    }

    public Optional<SimulationTrace> getTrace() {
        return Optional.ofNullable(trace);
    }

    public Optional<FailureKind> getFailure() {
        return Optional.ofNullable(failure);
    }
}
