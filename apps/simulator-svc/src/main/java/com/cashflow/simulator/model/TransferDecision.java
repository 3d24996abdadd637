package com.cashflow.simulator.model;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Breakdown of one surplus sweep evaluation. {@code lowestProjectedBalance} is empty when no
 * look-ahead balances were supplied or when the surplus was zero and the series was never read.
 */
public record TransferDecision(
        BigDecimal monthEndBalance,
        BigDecimal targetBalance,
        BigDecimal surplus,
        Optional<BigDecimal> lowestProjectedBalance,
        BigDecimal shortfall,
        BigDecimal recommendedTransfer
) {
    public boolean transferRecommended() {
        return recommendedTransfer.signum() > 0;
    }

    public BigDecimal holdback() {
        return surplus.subtract(recommendedTransfer);
    }
}
