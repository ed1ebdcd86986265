package com.gillianbc.annuity.model;

import lombok.Getter;
import lombok.NonNull;

import java.util.Collections;
import java.util.List;

/**
 * A solved annuity: the resolved inputs, the monthly trace, the yearly roll-up and the headline figures.
 */
@Getter
public class AnnuitySolution {

    @NonNull private final PolicyKind kind;
    /** Inputs with the unknown filled in by its solved value. */
    @NonNull private final SimulationInput resolvedInput;
    @NonNull private final SimulationTrace trace;
    @NonNull private final List<AnnualRecord> annual;
    @NonNull private final SolveSummary summary;

    public AnnuitySolution(@NonNull PolicyKind kind,
                           @NonNull SimulationInput resolvedInput,
                           @NonNull SimulationTrace trace,
                           @NonNull List<AnnualRecord> annual,
                           @NonNull SolveSummary summary) {
        this.kind = kind;
        this.resolvedInput = resolvedInput;
        this.trace = trace;
        this.annual = Collections.unmodifiableList(annual);
        this.summary = summary;
    }
}
