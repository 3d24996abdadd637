package com.cashflow.simulator.report;

import com.cashflow.simulator.model.ProfitAndLoss;
import com.cashflow.simulator.model.Transaction;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class ProfitAndLossFormatter {

    public String format(ProfitAndLoss profitAndLoss) {
        List<String> out = new ArrayList<>();
        out.add("CASH FLOW SUMMARY");
        out.add(SimulationReportFormatter.RULE);

        for (Map.Entry<String, Map<String, BigDecimal>> category : profitAndLoss.lines().entrySet()) {
            if (category.getValue().isEmpty()) {
                continue;
            }
            out.add("");
            out.add(category.getKey() + ":");
            category.getValue().forEach((description, amount) ->
                    out.add("  " + description + ": " + Amounts.format(amount)));
        }

        ProfitAndLoss.Statement statement = profitAndLoss.statement();
        out.add("");
        out.add("CASH FLOW STATEMENT:");
        out.add("  Revenue: " + Amounts.format(statement.revenue()));
        out.add("  Fixed Expenses: " + Amounts.format(statement.fixedExpenses()));
        out.add("  Variable Expenses: " + Amounts.format(statement.variableExpenses()));
        out.add("  Profit Margin: " + Amounts.format(statement.profitMargin()));
        out.add("  Misc Income: " + Amounts.format(statement.miscIncome()));
        out.add("  Misc Expenses: " + Amounts.format(statement.miscExpenses()));
        out.add("  Net Income: " + Amounts.format(statement.netIncome()));
        return String.join("\n", out);
    }

    public String formatUncategorized(List<Transaction> uncategorized) {
        StringBuilder out = new StringBuilder("WARNING: Uncategorized transactions found:");
        for (Transaction tx : uncategorized) {
            out.append("\n  ").append(tx.date())
                    .append(" | ").append(tx.description())
                    .append(" | Category: '").append(tx.category()).append("'");
        }
        return out.toString();
    }
}
