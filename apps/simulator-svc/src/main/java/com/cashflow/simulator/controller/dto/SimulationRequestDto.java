package com.cashflow.simulator.controller.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Balances and window are checked by the simulation itself so that callers get the same
 * INVALID_BALANCE / INVALID_WINDOW codes as every other entry point.
 */
public record SimulationRequestDto(
        BigDecimal startBalance,
        BigDecimal targetBalance,
        LocalDate startDate,
        Integer windowDays,
        List<@NotNull @Valid TransactionDto> transactions
) {
}
