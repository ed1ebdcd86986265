package com.gillianbc.annuity.validation;

import com.gillianbc.annuity.config.AnnuityProperties;
import com.gillianbc.annuity.model.InputField;
import com.gillianbc.annuity.model.PolicyKind;
import com.gillianbc.annuity.model.SimulationInput;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns raw form values into a {@link SimulationInput} for the chosen calculation, collecting every
 * field error rather than stopping at the first. The unknown field is ignored.
 * <p>
 * Characters other than digits and '.' are stripped before parsing, and only the first '.' is kept.
 */
@Component
public class AnnuityInputValidator {

    private final AnnuityProperties properties;

    public AnnuityInputValidator(AnnuityProperties properties) {
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
    }

    public ValidationResult validate(PolicyKind kind, AnnuityForm form) {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(form, "form must not be null");

        List<FieldError> errors = new ArrayList<>();
        Map<InputField, Double> values = new EnumMap<>(InputField.class);

        for (InputField field : kind.requiredFields()) {
            String raw = form.rawValue(field);
            if (raw == null || raw.isBlank()) {
                errors.add(new FieldError(field.fieldName(), "must not be empty"));
                continue;
            }
            Double value = parse(raw);
            if (value == null) {
                errors.add(new FieldError(field.fieldName(), "must be a number"));
                continue;
            }
            String problem = checkRange(field, value);
            if (problem != null) {
                errors.add(new FieldError(field.fieldName(), problem));
                continue;
            }
            values.put(field, value);
        }

        if (!errors.isEmpty()) {
            return ValidationResult.errors(errors);
        }

        return ValidationResult.ok(SimulationInput.builder()
                .principal(values.get(InputField.PRINCIPAL))
                .termYears(values.get(InputField.TERM))
                .annualRatePercent(values.get(InputField.RATE))
                .initialMonthlyWithdrawal(values.get(InputField.WITHDRAWAL))
                .annualIncreasePercent(values.get(InputField.INCREASE))
                .compoundingPeriodsPerYear(properties.compoundingPeriodsPerYear())
                .build());
    }

    static String sanitise(String raw) {
        return raw.replaceAll("[^0-9.]", "").replaceFirst("(\\..*?)\\..*", "$1");
    }

    private static Double parse(String raw) {
        String cleaned = sanitise(raw);
        if (cleaned.isEmpty() || cleaned.equals(".")) {
            return null;
        }
        // Only digits and at most one '.' remain, so this always parses
        return Double.valueOf(cleaned);
    }

    private static String checkRange(InputField field, double value) {
        return switch (field) {
            case PRINCIPAL, TERM, WITHDRAWAL -> value > 0 ? null : "must be greater than 0";
            case RATE, INCREASE -> value >= 0 && value <= 100 ? null : "must be a number between 0 and 100";
        };
    }
}
