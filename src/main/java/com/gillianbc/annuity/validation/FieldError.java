package com.gillianbc.annuity.validation;

import lombok.Getter;

import java.util.Objects;

/**
 * One rejected form field and why.
 */
@Getter
public class FieldError {

    private final String field;
    private final String message;

    public FieldError(String field, String message) {
        this.field = Objects.requireNonNull(field, "field must not be null");
        this.message = Objects.requireNonNull(message, "message must not be null");
    }

    @Override
    public String toString() {
        return field + ": " + message;
    }
}
