package com.cashflow.simulator.simulation;

import com.cashflow.simulator.config.CashflowProperties;
import com.cashflow.simulator.model.DayRecord;
import com.cashflow.simulator.model.SimulationReport;
import com.cashflow.simulator.model.SurplusTransfer;
import com.cashflow.simulator.model.Transaction;
import com.cashflow.simulator.model.TransferDecision;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs the day-by-day projection over the requested window and applies the surplus transfer rule
 * at every decision point. Applied transfers are appended to a working copy of the caller's
 * transactions and affect every later day of the same run, including later look-aheads.
 */
@Service
public class SimulationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(SimulationOrchestrator.class);

    private final DailyLedgerProjector projector;
    private final SurplusTransferAdvisor advisor;
    private final CashflowProperties.Simulation settings;

    public SimulationOrchestrator(
            DailyLedgerProjector projector,
            SurplusTransferAdvisor advisor,
            CashflowProperties properties
    ) {
        this.projector = projector;
        this.advisor = advisor;
        this.settings = properties.simulation();
    }

    public SimulationReport simulate(
            BigDecimal startBalance,
            BigDecimal targetBalance,
            Collection<Transaction> transactions,
            LocalDate startDate,
            int windowDays
    ) {
        SimulationPreconditions.requireWindow(windowDays);
        SimulationPreconditions.requireBalance("start_balance", startBalance);
        SimulationPreconditions.requireBalance("target_balance", targetBalance);
        SimulationPreconditions.requireStartDate(startDate);

        List<Transaction> working = new ArrayList<>();
        if (transactions != null) {
            transactions.stream().filter(Objects::nonNull).forEach(working::add);
        }

        List<DayRecord> days = new ArrayList<>(windowDays);
        List<SurplusTransfer> transfers = new ArrayList<>();
        BigDecimal balance = startBalance;
        for (int offset = 0; offset < windowDays; offset++) {
            LocalDate date = startDate.plusDays(offset);
            DayRecord day = projector.projectDay(date, balance, targetBalance, working);
            days.add(day);
            balance = day.endBalance();

            if (!settings.decisionPoint().isDecisionPoint(date)) {
                continue;
            }
            Optional<SurplusTransfer> transfer = decideTransfer(date, day.endBalance(), targetBalance, working);
            if (transfer.isPresent()) {
                SurplusTransfer applied = transfer.get();
                working.add(Transaction.surplusTransfer(
                        applied.transferDate(),
                        applied.amount(),
                        settings.transferDescription(),
                        settings.transferCategory()
                ));
                transfers.add(applied);
                log.info("Surplus transfer of {} scheduled for {} (decision point {}, holdback {})",
                        applied.amount(), applied.transferDate(), date, applied.decision().holdback());
            }
        }

        return new SimulationReport(startDate, windowDays, startBalance, targetBalance, days, transfers);
    }

    private Optional<SurplusTransfer> decideTransfer(
            LocalDate decisionDate,
            BigDecimal monthEndBalance,
            BigDecimal targetBalance,
            List<Transaction> working
    ) {
        if (monthEndBalance.compareTo(targetBalance) <= 0) {
            log.debug("Decision point {}: balance {} has no surplus over target {}", decisionDate, monthEndBalance, targetBalance);
            return Optional.empty();
        }

        // look-ahead starts from the target, as if the whole surplus had already left the account
        List<BigDecimal> lookAhead = projector.project(
                        targetBalance,
                        targetBalance,
                        List.copyOf(working),
                        decisionDate.plusDays(1),
                        settings.lookAheadDays()
                ).stream()
                .map(DayRecord::endBalance)
                .toList();

        TransferDecision decision = advisor.evaluate(monthEndBalance, targetBalance, lookAhead);
        log.debug("Decision point {}: surplus={}, lowestProjected={}, shortfall={}, recommended={}",
                decisionDate, decision.surplus(), decision.lowestProjectedBalance().orElse(null),
                decision.shortfall(), decision.recommendedTransfer());
        if (!decision.transferRecommended()) {
            return Optional.empty();
        }
        return Optional.of(new SurplusTransfer(decisionDate, DecisionPointPolicy.transferDateFor(decisionDate), decision));
    }
}
