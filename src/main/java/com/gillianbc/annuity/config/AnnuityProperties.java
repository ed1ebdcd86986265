package com.gillianbc.annuity.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "annuity")
public record AnnuityProperties(
        @DefaultValue("12") @Positive int compoundingPeriodsPerYear,
        @DefaultValue("ZAR") @NotBlank String currency,
        @DefaultValue("target/results") @NotBlank String reportDirectory
) {
}
