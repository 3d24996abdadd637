package com.cashflow.simulator.simulation;

import com.cashflow.simulator.model.DayRecord;
import com.cashflow.simulator.model.Transaction;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Replays dated transactions one calendar day at a time. Holds no state between calls, so the
 * same instance serves both the outer simulation and its look-ahead projections.
 */
@Component
public class DailyLedgerProjector {

    private static final String SUMMARY_SEPARATOR = ", ";

    public List<DayRecord> project(
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

        LocalDate endDate = startDate.plusDays(windowDays - 1L);
        Map<LocalDate, List<Transaction>> byDate = groupByDate(transactions, startDate, endDate);

        List<DayRecord> days = new ArrayList<>(windowDays);
        BigDecimal balance = startBalance;
        for (int offset = 0; offset < windowDays; offset++) {
            LocalDate date = startDate.plusDays(offset);
            DayRecord day = projectDay(date, balance, targetBalance, byDate.getOrDefault(date, List.of()));
            days.add(day);
            balance = day.endBalance();
        }
        return days;
    }

    /**
     * Projects a single day. Only transactions dated {@code date} contribute; the rest of the collection is skipped.
     */
    public DayRecord projectDay(
            LocalDate date,
            BigDecimal openingBalance,
            BigDecimal targetBalance,
            Collection<Transaction> transactions
    ) {
        BigDecimal netChange = BigDecimal.ZERO;
        StringBuilder summary = new StringBuilder();
        if (transactions != null) {
            for (Transaction tx : transactions) {
                if (tx == null || !tx.occursOn(date)) {
                    continue;
                }
                netChange = netChange.add(tx.amount());
                if (summary.length() > 0) {
                    summary.append(SUMMARY_SEPARATOR);
                }
                summary.append(tx.description())
                        .append(": ")
                        .append(tx.amount().setScale(2, RoundingMode.HALF_UP).toPlainString());
            }
        }

        BigDecimal endBalance = openingBalance.add(netChange);
        boolean belowTarget = endBalance.compareTo(targetBalance) < 0;
        return new DayRecord(
                date,
                openingBalance,
                summary.toString(),
                netChange,
                endBalance,
                belowTarget ? DayRecord.AlertType.BELOW_TARGET : DayRecord.AlertType.OK,
                belowTarget ? targetBalance.subtract(endBalance) : BigDecimal.ZERO
        );
    }

    private static Map<LocalDate, List<Transaction>> groupByDate(
            Collection<Transaction> transactions,
            LocalDate startDate,
            LocalDate endDate
    ) {
        Map<LocalDate, List<Transaction>> byDate = new HashMap<>();
        if (transactions == null) {
            return byDate;
        }
        for (Transaction tx : transactions) {
            if (tx == null || tx.date().isBefore(startDate) || tx.date().isAfter(endDate)) {
                continue;
            }
            byDate.computeIfAbsent(tx.date(), key -> new ArrayList<>()).add(tx);
        }
        return byDate;
    }
}
