package com.gillianbc.annuity.validation;

import com.gillianbc.annuity.config.AnnuityProperties;
import com.gillianbc.annuity.model.PolicyKind;
import com.gillianbc.annuity.model.SimulationInput;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AnnuityInputValidatorTest {

    private final AnnuityInputValidator validator =
            new AnnuityInputValidator(new AnnuityProperties(12, "ZAR", "target/results"));

    @Test
    @DisplayName("Valid withdrawal form becomes a SimulationInput without a withdrawal")
    void validate_withdrawal_ok() {
        AnnuityForm form = AnnuityForm.builder()
                .principal("1000000")
                .termYears("20")
                .annualRatePercent("8")
                .monthlyWithdrawal("999")
                .annualIncreasePercent("5")
                .build();

        ValidationResult result = validator.validate(PolicyKind.WITHDRAWAL, form);

        assertTrue(result.isValid());
        assertThat(result.getErrors()).isEmpty();
        SimulationInput input = result.getInput().orElseThrow();
        assertEquals(1_000_000.0, input.getPrincipal());
        assertEquals(20.0, input.getTermYears());
        assertEquals(8.0, input.getAnnualRatePercent());
        assertEquals(5.0, input.getAnnualIncreasePercent());
        assertEquals(12, input.getCompoundingPeriodsPerYear());
        assertNull(input.getInitialMonthlyWithdrawal());
    }

    @Test
    @DisplayName("Currency symbols, grouping and extra decimal points are stripped before parsing")
    void validate_stripsNonNumericCharacters() {
        AnnuityForm form = AnnuityForm.builder()
                .termYears("20 years")
                .annualRatePercent("7.5%")
                .monthlyWithdrawal("R 5,601.44.9")
                .annualIncreasePercent("5")
                .build();

        SimulationInput input = validator.validate(PolicyKind.PRINCIPAL, form).getInput().orElseThrow();

        assertEquals(20.0, input.getTermYears());
        assertEquals(7.5, input.getAnnualRatePercent());
        assertEquals(5601.44, input.getInitialMonthlyWithdrawal());
        assertNull(input.getPrincipal());
    }

    @Test
    @DisplayName("Every bad field is reported, not just the first")
    void validate_collectsAllErrors() {
        AnnuityForm form = AnnuityForm.builder()
                .principal("")
                .annualRatePercent("150")
                .monthlyWithdrawal("0")
                .annualIncreasePercent("abc")
                .build();

        ValidationResult result = validator.validate(PolicyKind.RATE, form);

        assertFalse(result.isValid());
        assertTrue(result.getInput().isEmpty());
        // rate is the unknown, so 150 is ignored
        assertThat(result.getErrors())
                .extracting(FieldError::getField, FieldError::getMessage)
                .containsExactly(
                        tuple("principal", "must not be empty"),
                        tuple("termYears", "must not be empty"),
                        tuple("monthlyWithdrawal", "must be greater than 0"),
                        tuple("annualIncreasePercent", "must be a number"));
    }

    @Test
    @DisplayName("Rates above 100% are rejected")
    void validate_rateOutOfRange() {
        AnnuityForm form = AnnuityForm.builder()
                .principal("1000")
                .annualRatePercent("101")
                .monthlyWithdrawal("10")
                .annualIncreasePercent("0")
                .build();

        ValidationResult result = validator.validate(PolicyKind.TERM, form);

        assertThat(result.getErrors()).hasSize(1);
        assertEquals("annualRatePercent", result.getErrors().get(0).getField());
        assertEquals("must be a number between 0 and 100", result.getErrors().get(0).getMessage());
    }

    @Test
    @DisplayName("Sanitising keeps digits and the first decimal point only")
    void sanitise_keepsFirstDecimalPoint() {
        assertEquals("1234.56", AnnuityInputValidator.sanitise("$1,234.56"));
        assertEquals("1.2", AnnuityInputValidator.sanitise("1.2.3"));
        assertEquals("5", AnnuityInputValidator.sanitise("-5"));
    }

    @Test
    @DisplayName("Null form throws NullPointerException")
    void validate_nullForm_throwsNPE() {
        assertThrows(NullPointerException.class, () -> validator.validate(PolicyKind.TERM, null));
    }
}
