package com.cashflow.simulator.cli;

import com.cashflow.simulator.config.CashflowProperties;
import com.cashflow.simulator.exception.UserDataNotFoundException;
import com.cashflow.simulator.model.SimulationReport;
import com.cashflow.simulator.report.ProfitAndLossFormatter;
import com.cashflow.simulator.report.SimulationReportFormatter;
import com.cashflow.simulator.service.CashflowReportService;
import java.io.PrintStream;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Command line entry point, active with {@code cashflow.cli.enabled=true} (the {@code cli} profile).
 */
@Component
@ConditionalOnProperty(value = "cashflow.cli.enabled", havingValue = "true")
public class CashflowCommandLineRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CashflowCommandLineRunner.class);

    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private final CashflowReportService reportService;
    private final SimulationReportFormatter simulationReportFormatter;
    private final ProfitAndLossFormatter profitAndLossFormatter;
    private final CashflowProperties properties;
    private final PrintStream out;
    private int exitCode;

    @Autowired
    public CashflowCommandLineRunner(
            CashflowReportService reportService,
            SimulationReportFormatter simulationReportFormatter,
            ProfitAndLossFormatter profitAndLossFormatter,
            CashflowProperties properties
    ) {
        this(reportService, simulationReportFormatter, profitAndLossFormatter, properties, System.out);
    }

    CashflowCommandLineRunner(
            CashflowReportService reportService,
            SimulationReportFormatter simulationReportFormatter,
            ProfitAndLossFormatter profitAndLossFormatter,
            CashflowProperties properties,
            PrintStream out
    ) {
        this.reportService = reportService;
        this.simulationReportFormatter = simulationReportFormatter;
        this.profitAndLossFormatter = profitAndLossFormatter;
        this.properties = properties;
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) {
        CommandLineOptions options;
        try {
            options = CommandLineOptions.parse(args, properties.simulation().defaultWindowDays());
        } catch (CliUsageException ex) {
            out.println("Error: " + ex.getMessage());
            out.println(CommandLineOptions.USAGE);
            exitCode = EXIT_USAGE;
            return;
        }

        out.println("Executing command: " + options.command().commandName());
        try {
            switch (options.command()) {
                case SUMMARIZE -> summarize(options);
                case SIMULATOR -> simulate(options);
            }
        } catch (UserDataNotFoundException | IllegalArgumentException ex) {
            log.warn("Command {} failed for user '{}': {}", options.command().commandName(), options.user(), ex.getMessage());
            out.println("Error: " + ex.getMessage());
            exitCode = EXIT_FAILURE;
        } catch (RuntimeException ex) {
            log.error("Unexpected error running {} for user '{}'", options.command().commandName(), options.user(), ex);
            String activity = options.command() == CommandLineOptions.Command.SIMULATOR ? "simulation" : "summary";
            out.println("Unexpected error during " + activity + ": " + ex.getMessage());
            exitCode = EXIT_FAILURE;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private void summarize(CommandLineOptions options) {
        CashflowReportService.SummaryResult result = reportService.summarizeForUser(options.user(), options.month());
        out.println(profitAndLossFormatter.format(result.profitAndLoss()));
        if (!result.uncategorized().isEmpty()) {
            out.println();
            out.println(profitAndLossFormatter.formatUncategorized(result.uncategorized()));
            Path file = reportService.writeUncategorized(options.user(), result.uncategorized());
            out.println();
            out.println("Uncategorized transactions saved to: " + file);
        }
    }

    private void simulate(CommandLineOptions options) {
        SimulationReport report = reportService.simulateForUser(options.user(), options.windowDays());
        out.print(simulationReportFormatter.format(report));
        Path file = reportService.writeSimulation(options.user(), report);
        out.println();
        out.println("Simulation results saved to: " + file);
    }
}
