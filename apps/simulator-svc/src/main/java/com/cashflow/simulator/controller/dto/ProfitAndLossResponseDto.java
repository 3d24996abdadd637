package com.cashflow.simulator.controller.dto;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

public record ProfitAndLossResponseDto(
        String user,
        String month,
        Map<String, Map<String, BigDecimal>> byCategory,
        Statement statement,
        List<TransactionDto> uncategorized,
        String traceId
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
