package com.gillianbc.annuity.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Which annuity parameter is unknown and must be solved for.
 */
public enum PolicyKind {
    WITHDRAWAL(InputField.WITHDRAWAL),
    TERM(InputField.TERM),
    PRINCIPAL(InputField.PRINCIPAL),
    RATE(InputField.RATE);

    private final InputField unknown;

    PolicyKind(InputField unknown) {
        this.unknown = unknown;
    }

    public InputField unknown() {
        return unknown;
    }

    /**
     * @return every field except the unknown one
     */
    public Set<InputField> requiredFields() {
        Set<InputField> required = EnumSet.allOf(InputField.class);
        required.remove(unknown);
        return required;
    }
}
