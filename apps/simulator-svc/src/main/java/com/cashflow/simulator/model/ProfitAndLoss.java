package com.cashflow.simulator.model;

import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.Map;

public record ProfitAndLoss(
        YearMonth month,
        Map<String, Map<String, BigDecimal>> lines,
        Statement statement
) {
    public record Statement(
            BigDecimal revenue,
            BigDecimal fixedExpenses,
            BigDecimal variableExpenses,
            BigDecimal profitMargin,
            BigDecimal miscIncome,
            BigDecimal miscExpenses,
            BigDecimal netIncome
    ) {
    }
}
