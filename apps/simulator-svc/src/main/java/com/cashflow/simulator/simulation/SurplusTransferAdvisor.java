package com.cashflow.simulator.simulation;

import com.cashflow.simulator.model.TransferDecision;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Decides how much of a month-end surplus can leave the account. The look-ahead balances are
 * expected to be projected from the target balance, i.e. as if the whole surplus had already gone;
 * any dip below target in that series is held back from the transfer.
 */
@Component
public class SurplusTransferAdvisor {

    private static final BigDecimal ZERO = BigDecimal.ZERO.setScale(2);

    public BigDecimal recommend(BigDecimal monthEndBalance, BigDecimal targetBalance, List<BigDecimal> futureBalances) {
        return evaluate(monthEndBalance, targetBalance, futureBalances).recommendedTransfer();
    }

    public TransferDecision evaluate(BigDecimal monthEndBalance, BigDecimal targetBalance, List<BigDecimal> futureBalances) {
        Objects.requireNonNull(monthEndBalance, "monthEndBalance");
        Objects.requireNonNull(targetBalance, "targetBalance");

        BigDecimal surplus = monthEndBalance.subtract(targetBalance).max(BigDecimal.ZERO);
        if (surplus.signum() == 0) {
            return new TransferDecision(monthEndBalance, targetBalance, ZERO, Optional.empty(), ZERO, ZERO);
        }

        Optional<BigDecimal> lowestFuture = futureBalances == null
                ? Optional.empty()
                : futureBalances.stream()
                        .filter(Objects::nonNull)
                        .min(Comparator.naturalOrder());
        BigDecimal shortfall = lowestFuture
                .map(lowest -> targetBalance.subtract(lowest).max(BigDecimal.ZERO))
                .orElse(BigDecimal.ZERO);
        BigDecimal recommended = surplus.subtract(shortfall).max(BigDecimal.ZERO);

        // cents are truncated toward the target so a sweep never takes the balance below it
        return new TransferDecision(
                monthEndBalance,
                targetBalance,
                surplus.setScale(2, RoundingMode.DOWN),
                lowestFuture,
                shortfall.setScale(2, RoundingMode.UP),
                recommended.setScale(2, RoundingMode.DOWN)
        );
    }
}
