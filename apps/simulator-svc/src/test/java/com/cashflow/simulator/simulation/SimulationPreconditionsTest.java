package com.cashflow.simulator.simulation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.cashflow.simulator.exception.InvalidBalanceException;
import com.cashflow.simulator.exception.InvalidWindowException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import org.junit.jupiter.api.Test;

class SimulationPreconditionsTest {

    @Test
    void acceptsPositiveWindow() {
        assertThat(SimulationPreconditions.requireWindow(1)).isEqualTo(1);
    }

    @Test
    void rejectsZeroWindowWithCode() {
        assertThatThrownBy(() -> SimulationPreconditions.requireWindow(0))
                .isInstanceOfSatisfying(InvalidWindowException.class, ex -> {
                    assertThat(ex.getCode()).isEqualTo("INVALID_WINDOW");
                    assertThat(ex.getWindowDays()).isZero();
                });
    }

    @Test
    void parsesNumericBalances() {
        assertThat(SimulationPreconditions.parseBalance("current_balance", 2500)).isEqualByComparingTo("2500");
        assertThat(SimulationPreconditions.parseBalance("current_balance", 2500.75d)).isEqualByComparingTo("2500.75");
        assertThat(SimulationPreconditions.parseBalance("current_balance", new BigInteger("12345678901234567890")))
                .isEqualByComparingTo("12345678901234567890");
        assertThat(SimulationPreconditions.parseBalance("current_balance", " 1000.50 ")).isEqualByComparingTo("1000.50");
        assertThat(SimulationPreconditions.parseBalance("current_balance", new BigDecimal("-12.5"))).isEqualByComparingTo("-12.5");
    }

    @Test
    void rejectsUnusableBalances() {
        assertThatThrownBy(() -> SimulationPreconditions.parseBalance("target_balance", null))
                .isInstanceOf(InvalidBalanceException.class)
                .hasMessage("target_balance must be provided");
        assertThatThrownBy(() -> SimulationPreconditions.parseBalance("target_balance", "  "))
                .isInstanceOf(InvalidBalanceException.class);
        assertThatThrownBy(() -> SimulationPreconditions.parseBalance("target_balance", "lots"))
                .isInstanceOf(InvalidBalanceException.class)
                .hasMessageContaining("is not numeric: 'lots'");
        assertThatThrownBy(() -> SimulationPreconditions.parseBalance("target_balance", Double.NaN))
                .isInstanceOf(InvalidBalanceException.class);
        assertThatThrownBy(() -> SimulationPreconditions.parseBalance("target_balance", List.of(1)))
                .isInstanceOfSatisfying(InvalidBalanceException.class,
                        ex -> assertThat(ex.getField()).isEqualTo("target_balance"));
    }
}
