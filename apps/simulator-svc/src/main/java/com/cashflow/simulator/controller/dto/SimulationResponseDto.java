package com.cashflow.simulator.controller.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

public record SimulationResponseDto(
        LocalDate startDate,
        int windowDays,
        BigDecimal startBalance,
        BigDecimal targetBalance,
        BigDecimal closingBalance,
        int alertCount,
        BigDecimal totalTransferred,
        List<Day> days,
        List<Transfer> transfers,
        String traceId
) {
    public record Day(
            LocalDate date,
            BigDecimal startBalance,
            String transactionsSummary,
            BigDecimal netChange,
            BigDecimal endBalance,
            String alertType,
            BigDecimal shortfall
    ) {
    }

    public record Transfer(
            LocalDate decisionDate,
            LocalDate transferDate,
            BigDecimal monthEndBalance,
            BigDecimal surplus,
            BigDecimal lowestProjectedBalance,
            BigDecimal holdback,
            BigDecimal amount
    ) {
    }
}
