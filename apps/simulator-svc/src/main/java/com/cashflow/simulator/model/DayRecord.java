package com.cashflow.simulator.model;

import java.math.BigDecimal;
import java.time.LocalDate;

public record DayRecord(
        LocalDate date,
        BigDecimal startBalance,
        String transactionsSummary,
        BigDecimal netChange,
        BigDecimal endBalance,
        AlertType alertType,
        BigDecimal shortfall
) {
    public enum AlertType {
        OK,
        BELOW_TARGET
    }

    public boolean belowTarget() {
        return alertType == AlertType.BELOW_TARGET;
    }
}
