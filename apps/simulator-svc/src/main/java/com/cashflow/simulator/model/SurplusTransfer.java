package com.cashflow.simulator.model;

import java.math.BigDecimal;
import java.time.LocalDate;

public record SurplusTransfer(LocalDate decisionDate, LocalDate transferDate, TransferDecision decision) {

    public BigDecimal amount() {
        return decision.recommendedTransfer();
    }
}
