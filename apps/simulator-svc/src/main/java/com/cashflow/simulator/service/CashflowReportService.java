package com.cashflow.simulator.service;

import com.cashflow.simulator.model.ProfitAndLoss;
import com.cashflow.simulator.model.SimulationReport;
import com.cashflow.simulator.model.Transaction;
import com.cashflow.simulator.model.UserConfig;
import com.cashflow.simulator.report.CsvReportWriter;
import com.cashflow.simulator.repository.UserLedgerRepository;
import com.cashflow.simulator.simulation.SimulationOrchestrator;
import com.cashflow.simulator.simulation.SimulationPreconditions;
import com.cashflow.simulator.summary.ProfitAndLossCalculator;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Glue between a user's files and the simulation and summary components. "Today" always comes from the injected clock.
 */
@Service
public class CashflowReportService {

    private static final Logger log = LoggerFactory.getLogger(CashflowReportService.class);
    private static final DateTimeFormatter FILE_DATE = DateTimeFormatter.ofPattern("yyyyMMdd");

    public record SummaryResult(String user, ProfitAndLoss profitAndLoss, List<Transaction> uncategorized) {
    }

    private final UserLedgerRepository userLedgerRepository;
    private final SimulationOrchestrator simulationOrchestrator;
    private final ProfitAndLossCalculator profitAndLossCalculator;
    private final CsvReportWriter csvReportWriter;
    private final Clock clock;

    public CashflowReportService(
            UserLedgerRepository userLedgerRepository,
            SimulationOrchestrator simulationOrchestrator,
            ProfitAndLossCalculator profitAndLossCalculator,
            CsvReportWriter csvReportWriter,
            Clock clock
    ) {
        this.userLedgerRepository = userLedgerRepository;
        this.simulationOrchestrator = simulationOrchestrator;
        this.profitAndLossCalculator = profitAndLossCalculator;
        this.csvReportWriter = csvReportWriter;
        this.clock = clock;
    }

    public SimulationReport simulateForUser(String user, int windowDays) {
        SimulationPreconditions.requireWindow(windowDays);
        UserConfig config = userLedgerRepository.loadConfig(user);
        List<Transaction> forecast = userLedgerRepository.loadLedger(user).stream()
                .filter(Transaction::forecast)
                .toList();
        LocalDate today = LocalDate.now(clock);
        log.info("Simulating user '{}' from {} over {} days with {} forecast transactions",
                user, today, windowDays, forecast.size());
        return simulationOrchestrator.simulate(
                config.currentBalance(),
                config.targetBalance(),
                forecast,
                today,
                windowDays
        );
    }

    public Path writeSimulation(String user, SimulationReport report) {
        Path file = userLedgerRepository.userDirectory(user)
                .resolve("simulation_output_" + FILE_DATE.format(LocalDate.now(clock)) + ".csv");
        csvReportWriter.writeSimulation(file, report.days());
        log.info("Wrote {} simulated days for user '{}' to {}", report.days().size(), user, file);
        return file;
    }

    public SummaryResult summarizeForUser(String user, YearMonth month) {
        UserConfig config = userLedgerRepository.loadConfig(user);
        List<Transaction> ledger = userLedgerRepository.loadLedger(user);
        List<Transaction> uncategorized = profitAndLossCalculator.findUncategorized(ledger, config.categories());
        ProfitAndLoss profitAndLoss = profitAndLossCalculator.calculate(ledger, month, config.categories());
        if (!uncategorized.isEmpty()) {
            log.warn("User '{}' has {} transactions outside the configured categories", user, uncategorized.size());
        }
        return new SummaryResult(user, profitAndLoss, uncategorized);
    }

    public Path writeUncategorized(String user, List<Transaction> uncategorized) {
        Path file = userLedgerRepository.userDirectory(user)
                .resolve("uncategorized_" + FILE_DATE.format(LocalDate.now(clock)) + ".csv");
        csvReportWriter.writeTransactions(file, uncategorized);
        return file;
    }
}
