package com.gillianbc.annuity.validation;

import com.gillianbc.annuity.model.SimulationInput;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Either a complete {@link SimulationInput} or the list of field errors that prevented one.
 */
public final class ValidationResult {

    private final SimulationInput input;
    private final List<FieldError> errors;

    private ValidationResult(SimulationInput input, List<FieldError> errors) {
        this.input = input;
        this.errors = errors;
    }

    public static ValidationResult ok(SimulationInput input) {
        return new ValidationResult(Objects.requireNonNull(input, "input must not be null"), List.of());
    }

    public static ValidationResult errors(List<FieldError> errors) {
        if (errors == null || errors.isEmpty()) {
            throw new IllegalArgumentException("errors must not be empty");
        }
        return new ValidationResult(null, List.copyOf(errors));
    }

    public boolean isValid() {
        return input != null;
    }

    public Optional<SimulationInput> getInput() {
        return Optional.ofNullable(input);
    }

    public List<FieldError> getErrors() {
        return errors;
    }
}
