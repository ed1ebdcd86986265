package com.gillianbc.annuity;

import com.gillianbc.annuity.config.AnnuityProperties;
import com.gillianbc.annuity.model.AnnuitySolution;
import com.gillianbc.annuity.model.PolicyKind;
import com.gillianbc.annuity.model.SolveResult;
import com.gillianbc.annuity.report.AnnuityReportService;
import com.gillianbc.annuity.report.CurrencyStyle;
import com.gillianbc.annuity.service.AnnuityCalculator;
import com.gillianbc.annuity.validation.AnnuityForm;
import com.gillianbc.annuity.validation.AnnuityInputValidator;
import com.gillianbc.annuity.validation.ValidationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Runs one calculation from the command line, e.g.
 * <pre>
 * --policy=WITHDRAWAL --principal=1000000 --term=20 --rate=8 --increase=5
 * </pre>
 * and writes the HTML report. Does nothing when no --policy is given.
 */
@Slf4j
@Component
public class AnnuityCommandLineRunner implements ApplicationRunner {

    private final AnnuityInputValidator validator;
    private final AnnuityCalculator calculator;
    private final AnnuityReportService reportService;
    private final AnnuityProperties properties;

    public AnnuityCommandLineRunner(AnnuityInputValidator validator,
                                    AnnuityCalculator calculator,
                                    AnnuityReportService reportService,
                                    AnnuityProperties properties) {
        this.validator = validator;
        this.calculator = calculator;
        this.reportService = reportService;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        String policy = option(args, "policy");
        if (policy == null) {
            return;
        }
        PolicyKind kind = PolicyKind.valueOf(policy.trim().toUpperCase(Locale.ROOT));

        AnnuityForm form = AnnuityForm.builder()
                .principal(option(args, "principal"))
                .termYears(option(args, "term"))
                .annualRatePercent(option(args, "rate"))
                .monthlyWithdrawal(option(args, "withdrawal"))
                .annualIncreasePercent(option(args, "increase"))
                .build();

        ValidationResult validation = validator.validate(kind, form);
        if (!validation.isValid()) {
            log.warn("Invalid input: {}", validation.getErrors());
            return;
        }

        SolveResult result = calculator.solve(validation.getInput().orElseThrow(), kind);
        String currencyCode = option(args, "currency");
        CurrencyStyle currency = CurrencyStyle.fromCode(currencyCode != null ? currencyCode : properties.currency());

        if (result.isSolved()) {
            AnnuitySolution solution = result.getSolution().orElseThrow();
            log.info(reportService.headline(solution, currency));
        } else {
            log.warn(AnnuityReportService.failureMessage(result.getFailure().orElseThrow()));
        }

        String html = reportService.render(result, currency);
        reportService.save(html, "annuity-" + kind.name().toLowerCase(Locale.ROOT));
    }

    private static String option(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }
}
