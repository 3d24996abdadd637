package com.cashflow.simulator.summary;

import com.cashflow.simulator.model.ProfitAndLoss;
import com.cashflow.simulator.model.Transaction;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.springframework.stereotype.Component;

/**
 * Monthly cash flow statement over the categories a user has declared valid. Transactions whose
 * category is not declared are left out of the statement and reported separately.
 */
@Component
public class ProfitAndLossCalculator {

    public static final String REVENUE = "Revenue";
    public static final String FIXED = "Fixed";
    public static final String VARIABLE = "Variable";
    public static final String MISC_INCOME = "Misc Income";
    public static final String MISC_EXPENSE = "Misc Expense";

    private static final DateTimeFormatter MONTH_FORMAT = DateTimeFormatter.ofPattern("yyyyMM");
    private static final BigDecimal ZERO = BigDecimal.ZERO.setScale(2, RoundingMode.HALF_UP);

    public static YearMonth parseMonth(String month) {
        if (month == null || month.isBlank()) {
            throw new IllegalArgumentException("month must be provided in YYYYMM format");
        }
        try {
            return YearMonth.parse(month.trim(), MONTH_FORMAT);
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException("month must be in YYYYMM format but was '" + month + "'", ex);
        }
    }

    public List<Transaction> findUncategorized(List<Transaction> transactions, Collection<String> validCategories) {
        return transactions.stream()
                .filter(tx -> !validCategories.contains(tx.category()))
                .toList();
    }

    public ProfitAndLoss calculate(List<Transaction> transactions, YearMonth month, Collection<String> validCategories) {
        LocalDate first = month.atDay(1);
        LocalDate last = month.atEndOfMonth();

        Map<String, Map<String, BigDecimal>> lines = new LinkedHashMap<>();
        for (String category : validCategories) {
            lines.put(category, new TreeMap<>());
        }
        for (Transaction tx : transactions) {
            if (tx.date().isBefore(first) || tx.date().isAfter(last)) {
                continue;
            }
            Map<String, BigDecimal> byDescription = lines.get(tx.category());
            if (byDescription == null) {
                continue;
            }
            byDescription.merge(tx.description(), tx.amount(), BigDecimal::add);
        }

        BigDecimal revenue = BigDecimal.ZERO;
        BigDecimal fixed = BigDecimal.ZERO;
        BigDecimal variable = BigDecimal.ZERO;
        BigDecimal miscIncome = BigDecimal.ZERO;
        BigDecimal miscExpenses = BigDecimal.ZERO;
        for (Map.Entry<String, Map<String, BigDecimal>> entry : lines.entrySet()) {
            for (BigDecimal amount : entry.getValue().values()) {
                switch (entry.getKey()) {
                    case REVENUE -> revenue = revenue.add(amount);
                    case FIXED -> fixed = fixed.subtract(amount.abs());
                    case VARIABLE -> variable = variable.subtract(amount.abs());
                    case MISC_INCOME -> miscIncome = miscIncome.add(amount.abs());
                    case MISC_EXPENSE -> miscExpenses = miscExpenses.subtract(amount.abs());
                    default -> {
                        // other declared categories appear in the lines but not in the statement
                    }
                }
            }
        }
        BigDecimal profitMargin = revenue.add(fixed).add(variable);
        BigDecimal netIncome = profitMargin.add(miscIncome).add(miscExpenses);

        ProfitAndLoss.Statement statement = new ProfitAndLoss.Statement(
                scaled(revenue),
                scaled(fixed),
                scaled(variable),
                scaled(profitMargin),
                scaled(miscIncome),
                scaled(miscExpenses),
                scaled(netIncome)
        );
        return new ProfitAndLoss(month, lines, statement);
    }

    private static BigDecimal scaled(BigDecimal value) {
        return value.signum() == 0 ? ZERO : value.setScale(2, RoundingMode.HALF_UP);
    }
}
