package com.cashflow.simulator.report;

import com.cashflow.simulator.model.DayRecord;
import com.cashflow.simulator.model.SimulationReport;
import com.cashflow.simulator.model.SurplusTransfer;
import java.time.LocalDate;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Console rendering of a simulation run: alerts first, then one SYSTEM_TRANSFER block per applied sweep.
 */
@Component
public class SimulationReportFormatter {

    static final String RULE = "=".repeat(40);

    public String format(SimulationReport report) {
        StringBuilder out = new StringBuilder();
        out.append("\nSIMULATION SUMMARY\n").append(RULE).append('\n');
        LocalDate windowEnd = report.startDate().plusDays(report.windowDays() - 1L);
        out.append("Window: ")
                .append(report.startDate())
                .append(" to ")
                .append(windowEnd)
                .append(" (").append(report.windowDays()).append(" days)\n");
        out.append("Starting balance: ").append(Amounts.format(report.startBalance()))
                .append(" | Target: ").append(Amounts.format(report.targetBalance()))
                .append(" | Closing balance: ").append(Amounts.format(report.closingBalance()))
                .append('\n');

        List<DayRecord> alerts = report.alerts();
        if (alerts.isEmpty()) {
            out.append("\nNo alerts: balance stays at or above target.\n");
        } else {
            out.append("\nALERTS:\n");
            for (DayRecord alert : alerts) {
                out.append("  ").append(alert.date())
                        .append(": Balance drops to ").append(Amounts.format(alert.endBalance()))
                        .append(" (below target of ").append(Amounts.format(report.targetBalance())).append(")\n");
                out.append("    SYSTEM RECOMMENDATION: Add ").append(Amounts.format(alert.shortfall()))
                        .append(" to reach target balance\n");
            }
        }

        for (SurplusTransfer transfer : report.transfers()) {
            out.append("\nSYSTEM_TRANSFER:\n");
            out.append("  Recommended Transfer: ").append(Amounts.format(transfer.amount())).append('\n');
            if (transfer.decision().holdback().signum() > 0) {
                out.append("  Held back for upcoming shortfall: ")
                        .append(Amounts.format(transfer.decision().holdback())).append('\n');
            }
            if (transfer.transferDate().isAfter(windowEnd)) {
                out.append("  Transfer is due on ").append(transfer.transferDate())
                        .append(", after the simulated window\n");
            } else {
                out.append("  A virtual transfer has been added to the simulation on ")
                        .append(transfer.transferDate()).append('\n');
            }
        }
        return out.toString();
    }
}
