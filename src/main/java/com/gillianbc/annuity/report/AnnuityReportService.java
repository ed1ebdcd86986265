package com.gillianbc.annuity.report;

import com.gillianbc.annuity.config.AnnuityProperties;
import com.gillianbc.annuity.model.AnnualRecord;
import com.gillianbc.annuity.model.AnnuitySolution;
import com.gillianbc.annuity.model.FailureKind;
import com.gillianbc.annuity.model.PeriodRecord;
import com.gillianbc.annuity.model.SimulationInput;
import com.gillianbc.annuity.model.SolveResult;
import com.gillianbc.annuity.model.SolveSummary;
import com.gillianbc.annuity.service.AmortizationSimulator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Formats a solve result as an HTML page: the headline answer, the summary figures, and the annual
 * and monthly tables. Failures become the message shown to the user.
 */
@Slf4j
@Service
public class AnnuityReportService {

    public static final String CALCULATION_FAILED_MESSAGE = "Please check the input values are reasonable";
    public static final String CALCULATION_TOO_LONG_MESSAGE = "This annuity will last longer than "
            + AmortizationSimulator.CALCULATION_LIMIT_YEARS + " years. Please increase the monthly withdrawal";

    private final AnnuityProperties properties;

    public AnnuityReportService(AnnuityProperties properties) {
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
    }

    public static String failureMessage(FailureKind failure) {
        return switch (failure) {
            case SEARCH_FAILED -> CALCULATION_FAILED_MESSAGE;
            case CALCULATION_TOO_LONG -> CALCULATION_TOO_LONG_MESSAGE;
        };
    }

    /**
     * The main answer line, e.g. "Monthly Income: R 5,601.44 Increasing at 5.0% per annum".
     */
    public String headline(AnnuitySolution solution, CurrencyStyle currency) {
        SimulationInput input = solution.getResolvedInput();
        double solved = solution.getSummary().getSolvedValue();
        return switch (solution.getKind()) {
            case WITHDRAWAL -> "Monthly Income: " + currency.format(solved)
                    + " Increasing at " + input.getAnnualIncreasePercent() + "% per annum";
            case TERM -> "Annuity Term: " + String.format(Locale.ROOT, "%.1f", solved) + " years";
            case PRINCIPAL -> "Principal: " + currency.format(solved);
            case RATE -> "Interest Rate: " + String.format(Locale.ROOT, "%.3f", solved) + "%";
        };
    }

    public String render(SolveResult result, CurrencyStyle currency) {
        Objects.requireNonNull(result, "result must not be null");
        Objects.requireNonNull(currency, "currency must not be null");

        StringBuilder html = new StringBuilder();
        html.append("<!DOCTYPE html>\n")
            .append("<html lang=\"en\">\n")
            .append("<head>\n")
            .append("    <meta charset=\"UTF-8\">\n")
            .append("    <title>Annuity Calculation</title>\n")
            .append("    <style>\n")
            .append("        body { font-family: Arial, sans-serif; margin: 20px; background-color: #f5f5f5; }\n")
            .append("        .container { max-width: 1000px; margin: 0 auto; background-color: white; padding: 20px; border-radius: 8px; }\n")
            .append("        .summary { background-color: #ecf0f1; padding: 15px; border-radius: 5px; margin-bottom: 30px; }\n")
            .append("        .error { background-color: #fab1a0; padding: 15px; border-radius: 5px; }\n")
            .append("        table { width: 100%; border-collapse: collapse; margin-top: 10px; }\n")
            .append("        th, td { border: 1px solid #ddd; padding: 6px; text-align: right; }\n")
            .append("        th { background-color: #3498db; color: white; }\n")
            .append("        th.year-end { background-color: #2c3e50; text-align: center; }\n")
            .append("    </style>\n")
            .append("</head>\n")
            .append("<body>\n")
            .append("    <div class=\"container\">\n")
            .append("        <h1>Annuity Calculation</h1>\n");

        if (result.isSolved()) {
            appendSolution(html, result.getSolution().orElseThrow(), currency);
        } else {
            html.append("        <div class=\"error\"><p>")
                .append(failureMessage(result.getFailure().orElseThrow()))
                .append("</p></div>\n");
        }

        html.append("        <p><em>Generated on: ")
            .append(LocalDateTime.now().format(DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss")))
            .append("</em></p>\n")
            .append("    </div>\n")
            .append("</body>\n")
            .append("</html>");
        return html.toString();
    }

    private void appendSolution(StringBuilder html, AnnuitySolution solution, CurrencyStyle currency) {
        SolveSummary summary = solution.getSummary();

        html.append("        <div class=\"summary\">\n")
            .append("            <h2>").append(headline(solution, currency)).append("</h2>\n")
            .append("            <p><strong>Initial Annual Income:</strong> ").append(currency.format(summary.getInitialAnnualIncome())).append("</p>\n")
            .append("            <p><strong>Draw Down Percentage:</strong> ").append(String.format(Locale.ROOT, "%.1f", summary.getDrawDownPercent())).append("%</p>\n")
            .append("            <p><strong>Total Withdrawn:</strong> ").append(currency.format(summary.getTotalWithdrawn())).append("</p>\n")
            .append("            <p><strong>Total Interest:</strong> ").append(currency.format(summary.getTotalInterest())).append("</p>\n")
            .append("        </div>\n");

        html.append("        <h2>Annual Results</h2>\n")
            .append("        <table>\n")
            .append("            <thead><tr><th>Year</th><th>Start Balance</th><th>Interest</th><th>Withdrawal</th><th>End Balance</th></tr></thead>\n")
            .append("            <tbody>\n");
        for (AnnualRecord a : solution.getAnnual()) {
            html.append("                <tr><td>").append(a.getYear()).append("</td>")
                .append("<td>").append(currency.format(a.getStartBalance())).append("</td>")
                .append("<td>").append(currency.format(a.getInterestPayment())).append("</td>")
                .append("<td>").append(currency.format(a.getWithdrawal())).append("</td>")
                .append("<td>").append(currency.format(a.getEndBalance())).append("</td></tr>\n");
        }
        html.append("            </tbody>\n")
            .append("        </table>\n");

        List<PeriodRecord> periods = solution.getTrace().getPeriods();
        html.append("        <h2>Monthly Results</h2>\n")
            .append("        <table>\n")
            .append("            <thead><tr><th>Month</th><th>Start Balance</th><th>Interest</th><th>Withdrawal</th><th>End Balance</th></tr></thead>\n")
            .append("            <tbody>\n");
        for (int idx = 0; idx < periods.size(); idx++) {
            PeriodRecord p = periods.get(idx);
            html.append("                <tr><td>").append(p.getPeriod()).append("</td>")
                .append("<td>").append(currency.format(p.getStartBalance())).append("</td>")
                .append("<td>").append(currency.format(p.getInterestPayment())).append("</td>")
                .append("<td>").append(currency.format(p.getWithdrawal())).append("</td>")
                .append("<td>").append(currency.format(p.getEndBalance())).append("</td></tr>\n");
            if ((idx + 1) % 12 == 0 || idx + 1 == periods.size()) {
                html.append("                <tr><th class=\"year-end\" colspan=\"5\">Year #")
                    .append(p.year()).append(" End</th></tr>\n");
            }
        }
        html.append("            </tbody>\n")
            .append("        </table>\n");
    }

    /**
     * Writes the report under the configured report directory with a timestamped name.
     *
     * @param prefix file name prefix, e.g. "annuity-withdrawal"
     * @return the file written
     */
    public Path save(String htmlContent, String prefix) {
        Objects.requireNonNull(htmlContent, "htmlContent must not be null");
        Objects.requireNonNull(prefix, "prefix must not be null");
        Path resultsDir = Paths.get(properties.reportDirectory());
        try {
            Files.createDirectories(resultsDir);

            String timestamp = LocalDateTime.now().format(DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss"));
            Path filePath = resultsDir.resolve(prefix + "-" + timestamp + ".html");

            Files.write(filePath, htmlContent.getBytes(StandardCharsets.UTF_8));

            log.info("Annuity report saved to: {}", filePath.toAbsolutePath());
            return filePath;
        } catch (IOException e) {
            log.error("Failed to save HTML report to {}", resultsDir, e);
            throw new UncheckedIOException("Failed to save HTML report", e);
        }
    }
}
