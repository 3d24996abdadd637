package com.cashflow.simulator.controller.dto;

import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.time.LocalDate;

public record TransactionDto(
        @NotNull LocalDate date,
        @NotNull BigDecimal amount,
        String description,
        String category,
        Boolean forecast
) {
}
