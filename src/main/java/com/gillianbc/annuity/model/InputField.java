package com.gillianbc.annuity.model;

import java.util.function.Function;

/**
 * The user-supplied annuity parameters, with the name used for them on forms and in error reports.
 */
public enum InputField {
    PRINCIPAL("principal", SimulationInput::getPrincipal),
    TERM("termYears", SimulationInput::getTermYears),
    RATE("annualRatePercent", SimulationInput::getAnnualRatePercent),
    WITHDRAWAL("monthlyWithdrawal", SimulationInput::getInitialMonthlyWithdrawal),
    INCREASE("annualIncreasePercent", SimulationInput::getAnnualIncreasePercent);

    private final String fieldName;
    private final Function<SimulationInput, Double> getter;

    InputField(String fieldName, Function<SimulationInput, Double> getter) {
        this.fieldName = fieldName;
        this.getter = getter;
    }

    public String fieldName() {
        return fieldName;
    }

    public Double valueOf(SimulationInput input) {
        return getter.apply(input);
    }
}
