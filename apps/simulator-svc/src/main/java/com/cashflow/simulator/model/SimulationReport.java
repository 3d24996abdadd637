package com.cashflow.simulator.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

public record SimulationReport(
        LocalDate startDate,
        int windowDays,
        BigDecimal startBalance,
        BigDecimal targetBalance,
        List<DayRecord> days,
        List<SurplusTransfer> transfers
) {
    public SimulationReport {
        days = List.copyOf(days);
        transfers = List.copyOf(transfers);
    }

    public List<DayRecord> alerts() {
        return days.stream()
                .filter(DayRecord::belowTarget)
                .toList();
    }

    public BigDecimal totalTransferred() {
        return transfers.stream()
                .map(SurplusTransfer::amount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public BigDecimal closingBalance() {
        return days.isEmpty() ? startBalance : days.get(days.size() - 1).endBalance();
    }
}
