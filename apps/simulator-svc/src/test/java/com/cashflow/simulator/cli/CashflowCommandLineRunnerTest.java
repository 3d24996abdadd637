package com.cashflow.simulator.cli;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.cashflow.simulator.config.CashflowProperties;
import com.cashflow.simulator.exception.InvalidWindowException;
import com.cashflow.simulator.exception.UserDataNotFoundException;
import com.cashflow.simulator.model.ProfitAndLoss;
import com.cashflow.simulator.model.SimulationReport;
import com.cashflow.simulator.model.Transaction;
import com.cashflow.simulator.report.ProfitAndLossFormatter;
import com.cashflow.simulator.report.SimulationReportFormatter;
import com.cashflow.simulator.service.CashflowReportService;
import com.cashflow.simulator.summary.ProfitAndLossCalculator;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.boot.DefaultApplicationArguments;

class CashflowCommandLineRunnerTest {

    @Mock
    private CashflowReportService reportService;

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

    private CashflowCommandLineRunner runner;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        CashflowProperties properties = new CashflowProperties(
                "users", "UTC", new CashflowProperties.Simulation(45, null, null, null, null), null);
        runner = new CashflowCommandLineRunner(
                reportService,
                new SimulationReportFormatter(),
                new ProfitAndLossFormatter(),
                properties,
                new PrintStream(buffer, true, StandardCharsets.UTF_8));
    }

    @Test
    void runsSimulatorAndReportsOutputFile() {
        SimulationReport report = new SimulationReport(
                LocalDate.of(2024, 1, 5), 45, new BigDecimal("3000"), new BigDecimal("2500"), List.of(), List.of());
        when(reportService.simulateForUser("alice", 45)).thenReturn(report);
        when(reportService.writeSimulation("alice", report)).thenReturn(Path.of("users/alice/simulation_output_20240105.csv"));

        runner.run(new DefaultApplicationArguments("simulator", "--user=alice"));

        String output = output();
        assertThat(output).contains("Executing command: simulator");
        assertThat(output).contains("SIMULATION SUMMARY");
        assertThat(output).contains("Simulation results saved to: " + Path.of("users/alice/simulation_output_20240105.csv"));
        assertThat(runner.getExitCode()).isZero();
    }

    @Test
    void runsSummarizeAndSavesUncategorized() {
        List<Transaction> uncategorized = List.of(
                new Transaction(LocalDate.of(2023, 12, 25), new BigDecimal("-75.50"), "Groceries", "Varaible", false));
        ProfitAndLoss pnl = new ProfitAndLossCalculator().calculate(List.of(), YearMonth.of(2023, 12), List.of("Revenue"));
        when(reportService.summarizeForUser("alice", YearMonth.of(2023, 12)))
                .thenReturn(new CashflowReportService.SummaryResult("alice", pnl, uncategorized));
        when(reportService.writeUncategorized("alice", uncategorized)).thenReturn(Path.of("uncategorized_20240105.csv"));

        runner.run(new DefaultApplicationArguments("summarize", "--user=alice", "--month=202312"));

        String output = output();
        assertThat(output).contains("CASH FLOW SUMMARY");
        assertThat(output).contains("WARNING: Uncategorized transactions found:");
        assertThat(output).contains("Uncategorized transactions saved to: uncategorized_20240105.csv");
        assertThat(runner.getExitCode()).isZero();
    }

    @Test
    void printsUsageForBadArguments() {
        runner.run(new DefaultApplicationArguments("summarize", "--user=alice"));

        assertThat(output()).contains("Error: --month is required").contains("Usage:");
        assertThat(runner.getExitCode()).isEqualTo(CashflowCommandLineRunner.EXIT_USAGE);
        verify(reportService, never()).summarizeForUser(any(), any());
    }

    @Test
    void reportsMissingUserData() {
        when(reportService.simulateForUser("ghost", 45))
                .thenThrow(new UserDataNotFoundException("Config", Path.of("users/ghost/config.yaml")));

        runner.run(new DefaultApplicationArguments("simulator", "--user=ghost"));

        assertThat(output()).contains("Error: Config file not found");
        assertThat(runner.getExitCode()).isEqualTo(CashflowCommandLineRunner.EXIT_FAILURE);
    }

    @Test
    void reportsInvalidWindow() {
        when(reportService.simulateForUser("alice", -5)).thenThrow(new InvalidWindowException(-5));

        runner.run(new DefaultApplicationArguments("simulator", "--user=alice", "--window=-5"));

        assertThat(output()).contains("Error: window_days must be positive but was -5");
        assertThat(runner.getExitCode()).isEqualTo(CashflowCommandLineRunner.EXIT_FAILURE);
    }

    @Test
    void reportsUnexpectedFailures() {
        when(reportService.simulateForUser("alice", 45)).thenThrow(new IllegalStateException("disk on fire"));

        runner.run(new DefaultApplicationArguments("simulator", "--user=alice"));

        assertThat(output()).contains("Unexpected error during simulation: disk on fire");
        assertThat(runner.getExitCode()).isEqualTo(CashflowCommandLineRunner.EXIT_FAILURE);
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }
}
