package com.cashflow.simulator.controller;

import com.cashflow.simulator.controller.dto.ProfitAndLossResponseDto;
import com.cashflow.simulator.controller.dto.TransactionDto;
import com.cashflow.simulator.model.ProfitAndLoss;
import com.cashflow.simulator.service.CashflowReportService;
import com.cashflow.simulator.summary.ProfitAndLossCalculator;
import com.cashflow.simulator.web.RequestContextHolder;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class SummaryController {

    private final CashflowReportService reportService;

    public SummaryController(CashflowReportService reportService) {
        this.reportService = reportService;
    }

    @GetMapping("/users/{user}/summary")
    public ResponseEntity<ProfitAndLossResponseDto> summary(
            @PathVariable("user") String user,
            @RequestParam("month") String month
    ) {
        RequestContextHolder.setUser(user);
        CashflowReportService.SummaryResult result =
                reportService.summarizeForUser(user, ProfitAndLossCalculator.parseMonth(month));
        ProfitAndLoss.Statement statement = result.profitAndLoss().statement();
        return ResponseEntity.ok(new ProfitAndLossResponseDto(
                user,
                result.profitAndLoss().month().toString(),
                result.profitAndLoss().lines(),
                new ProfitAndLossResponseDto.Statement(
                        statement.revenue(),
                        statement.fixedExpenses(),
                        statement.variableExpenses(),
                        statement.profitMargin(),
                        statement.miscIncome(),
                        statement.miscExpenses(),
                        statement.netIncome()
                ),
                result.uncategorized().stream()
                        .map(tx -> new TransactionDto(tx.date(), tx.amount(), tx.description(), tx.category(), tx.forecast()))
                        .toList(),
                RequestContextHolder.traceId().orElse(null)
        ));
    }
}
