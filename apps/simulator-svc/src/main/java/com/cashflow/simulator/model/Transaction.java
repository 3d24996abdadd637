package com.cashflow.simulator.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A single dated cash event. Positive amounts are inflows, negative amounts outflows.
 */
public record Transaction(
        LocalDate date,
        BigDecimal amount,
        String description,
        String category,
        boolean forecast
) {
    public Transaction {
        if (date == null) {
            throw new IllegalArgumentException("date must be provided");
        }
        if (amount == null) {
            throw new IllegalArgumentException("amount must be provided");
        }
        description = description == null ? "" : description;
        category = category == null ? "" : category;
    }

    /**
     * Builds the synthetic transaction that carries a recommended sweep through the rest of a simulation run.
     * The amount is stored as an outflow regardless of the sign passed in.
     */
    public static Transaction surplusTransfer(LocalDate date, BigDecimal amount, String description, String category) {
        return new Transaction(date, amount.abs().negate(), description, category, true);
    }

    public boolean occursOn(LocalDate day) {
        return date.isEqual(day);
    }
}
