package com.gillianbc.annuity.validation;

import com.gillianbc.annuity.model.InputField;
import lombok.Builder;
import lombok.Getter;

/**
 * Raw, unparsed values as typed into the calculator form or given on the command line.
 * Any of them may be null or blank.
 */
@Getter
@Builder
public class AnnuityForm {

    private final String principal;
    private final String termYears;
    private final String annualRatePercent;
    private final String monthlyWithdrawal;
    private final String annualIncreasePercent;

    public String rawValue(InputField field) {
        return switch (field) {
            case PRINCIPAL -> principal;
            case TERM -> termYears;
            case RATE -> annualRatePercent;
            case WITHDRAWAL -> monthlyWithdrawal;
            case INCREASE -> annualIncreasePercent;
        };
    }
}
