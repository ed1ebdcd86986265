package com.gillianbc.annuity.service;

import com.gillianbc.annuity.model.PolicyKind;
import com.gillianbc.annuity.model.SimulationInput;
import com.gillianbc.annuity.model.SolveResult;

/**
 * Solves for one unknown annuity parameter and produces the full trajectory for the result.
 */
public interface SolverPolicy {

    PolicyKind kind();

    /**
     * @throws MissingInputException if any field other than the unknown is null
     */
    SolveResult solve(SimulationInput input);
}
