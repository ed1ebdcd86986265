package com.gillianbc.annuity.report;

import com.gillianbc.annuity.config.AnnuityProperties;
import com.gillianbc.annuity.model.AnnuitySolution;
import com.gillianbc.annuity.model.FailureKind;
import com.gillianbc.annuity.model.PolicyKind;
import com.gillianbc.annuity.model.SimulationInput;
import com.gillianbc.annuity.model.SolveResult;
import com.gillianbc.annuity.service.AmortizationSimulator;
import com.gillianbc.annuity.service.AnnuityCalculator;
import com.gillianbc.annuity.service.ParameterSolver;
import com.gillianbc.annuity.service.PrincipalPolicy;
import com.gillianbc.annuity.service.RatePolicy;
import com.gillianbc.annuity.service.ResultAggregator;
import com.gillianbc.annuity.service.TermPolicy;
import com.gillianbc.annuity.service.WithdrawalPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AnnuityReportServiceTest {

    private final AmortizationSimulator simulator = new AmortizationSimulator();
    private final ParameterSolver solver = new ParameterSolver();
    private final ResultAggregator aggregator = new ResultAggregator();
    private final AnnuityCalculator calculator = new AnnuityCalculator(List.of(
            new WithdrawalPolicy(simulator, solver, aggregator),
            new TermPolicy(simulator, solver, aggregator),
            new PrincipalPolicy(simulator, solver, aggregator),
            new RatePolicy(simulator, solver, aggregator)));

    private final SimulationInput termInput = SimulationInput.builder()
            .principal(2500.0)
            .annualRatePercent(0.0)
            .initialMonthlyWithdrawal(100.0)
            .annualIncreasePercent(10.0)
            .build();

    @Test
    @DisplayName("Headline describes the solved parameter")
    void headline_perKind() {
        AnnuityReportService service = new AnnuityReportService(properties("target/results"));
        AnnuitySolution solution = calculator.solve(termInput, PolicyKind.TERM).getSolution().orElseThrow();

        assertEquals("Annuity Term: 2.0 years", service.headline(solution, CurrencyStyle.ZAR));
    }

    @Test
    @DisplayName("Report lists summary figures, both tables and a separator after each year")
    void render_solution() {
        AnnuityReportService service = new AnnuityReportService(properties("target/results"));
        SolveResult result = calculator.solve(termInput, PolicyKind.TERM);

        String html = service.render(result, CurrencyStyle.USD);

        assertThat(html)
                .contains("<h2>Annuity Term: 2.0 years</h2>")
                .contains("<strong>Initial Annual Income:</strong> $ 1,200.00")
                .contains("<strong>Draw Down Percentage:</strong> 48.0%")
                .contains("<strong>Total Withdrawn:</strong> $ 2,500.00")
                .contains("<strong>Total Interest:</strong> $ 0.00")
                .contains("Year #1 End")
                .contains("Year #2 End")
                .doesNotContain("Year #3 End");
    }

    @Test
    @DisplayName("Failures render the message for their kind")
    void render_failures() {
        AnnuityReportService service = new AnnuityReportService(properties("target/results"));

        assertThat(service.render(SolveResult.failed(FailureKind.SEARCH_FAILED), CurrencyStyle.ZAR))
                .contains("Please check the input values are reasonable");
        assertThat(service.render(SolveResult.failed(FailureKind.CALCULATION_TOO_LONG), CurrencyStyle.ZAR))
                .contains("This annuity will last longer than 1000 years. Please increase the monthly withdrawal");
    }

    @Test
    @DisplayName("Report is written under the configured directory")
    void save_writesFile(@TempDir Path tempDir) throws IOException {
        Path reportDir = tempDir.resolve("reports");
        AnnuityReportService service = new AnnuityReportService(properties(reportDir.toString()));

        Path written = service.save("<html></html>", "annuity-term");

        assertTrue(Files.exists(written));
        assertEquals(reportDir, written.getParent());
        assertThat(written.getFileName().toString()).startsWith("annuity-term-").endsWith(".html");
        assertEquals("<html></html>", Files.readString(written, StandardCharsets.UTF_8));
    }

    private static AnnuityProperties properties(String reportDirectory) {
        return new AnnuityProperties(12, "ZAR", reportDirectory);
    }
}
