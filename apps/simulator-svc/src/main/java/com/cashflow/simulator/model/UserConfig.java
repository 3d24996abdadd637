package com.cashflow.simulator.model;

import java.math.BigDecimal;
import java.util.List;

public record UserConfig(
        String accountNickname,
        BigDecimal currentBalance,
        BigDecimal targetBalance,
        List<String> categories
) {
    public UserConfig {
        categories = categories == null ? List.of() : List.copyOf(categories);
    }
}
