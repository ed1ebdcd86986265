package com.gillianbc.annuity.service;

import com.gillianbc.annuity.model.PolicyKind;
import lombok.Getter;

import java.util.List;

/**
 * Thrown when a solver policy is handed an input without one of the fields it needs.
 * This is a caller error: the validation step should never let it happen.
 */
@Getter
public class MissingInputException extends IllegalArgumentException {

    private final PolicyKind kind;
    private final List<String> missingFields;

    public MissingInputException(PolicyKind kind, List<String> missingFields) {
        super("Cannot solve for " + kind + ": missing " + String.join(", ", missingFields));
        this.kind = kind;
        this.missingFields = List.copyOf(missingFields);
    }
}
