package com.cashflow.simulator.controller;

import com.cashflow.simulator.config.CashflowProperties;
import com.cashflow.simulator.controller.dto.SimulationRequestDto;
import com.cashflow.simulator.controller.dto.SimulationResponseDto;
import com.cashflow.simulator.controller.dto.TransactionDto;
import com.cashflow.simulator.model.SimulationReport;
import com.cashflow.simulator.model.Transaction;
import com.cashflow.simulator.service.CashflowReportService;
import com.cashflow.simulator.simulation.SimulationOrchestrator;
import com.cashflow.simulator.web.RequestContextHolder;
import jakarta.validation.Valid;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class SimulationController {

    private final SimulationOrchestrator simulationOrchestrator;
    private final CashflowReportService reportService;
    private final CashflowProperties properties;
    private final Clock clock;

    public SimulationController(
            SimulationOrchestrator simulationOrchestrator,
            CashflowReportService reportService,
            CashflowProperties properties,
            Clock clock
    ) {
        this.simulationOrchestrator = simulationOrchestrator;
        this.reportService = reportService;
        this.properties = properties;
        this.clock = clock;
    }

    @PostMapping("/simulations")
    public ResponseEntity<SimulationResponseDto> simulate(@Valid @RequestBody SimulationRequestDto request) {
        List<Transaction> transactions = request.transactions() == null
                ? List.of()
                : request.transactions().stream().map(SimulationController::toTransaction).toList();
        SimulationReport report = simulationOrchestrator.simulate(
                request.startBalance(),
                request.targetBalance(),
                transactions,
                request.startDate() != null ? request.startDate() : LocalDate.now(clock),
                request.windowDays() != null ? request.windowDays() : properties.simulation().defaultWindowDays()
        );
        return ResponseEntity.ok(map(report));
    }

    @GetMapping("/users/{user}/simulation")
    public ResponseEntity<SimulationResponseDto> simulateForUser(
            @PathVariable("user") String user,
            @RequestParam(value = "window", required = false) Integer window
    ) {
        RequestContextHolder.setUser(user);
        int windowDays = window != null ? window : properties.simulation().defaultWindowDays();
        return ResponseEntity.ok(map(reportService.simulateForUser(user, windowDays)));
    }

    private static Transaction toTransaction(TransactionDto dto) {
        return new Transaction(
                dto.date(),
                dto.amount(),
                dto.description(),
                dto.category(),
                Boolean.TRUE.equals(dto.forecast())
        );
    }

    private SimulationResponseDto map(SimulationReport report) {
        return new SimulationResponseDto(
                report.startDate(),
                report.windowDays(),
                report.startBalance(),
                report.targetBalance(),
                report.closingBalance(),
                report.alerts().size(),
                report.totalTransferred(),
                report.days().stream()
                        .map(day -> new SimulationResponseDto.Day(
                                day.date(),
                                day.startBalance(),
                                day.transactionsSummary(),
                                day.netChange(),
                                day.endBalance(),
                                day.alertType().name(),
                                day.shortfall()
                        ))
                        .toList(),
                report.transfers().stream()
                        .map(transfer -> new SimulationResponseDto.Transfer(
                                transfer.decisionDate(),
                                transfer.transferDate(),
                                transfer.decision().monthEndBalance(),
                                transfer.decision().surplus(),
                                transfer.decision().lowestProjectedBalance().orElse(null),
                                transfer.decision().holdback(),
                                transfer.amount()
                        ))
                        .toList(),
                RequestContextHolder.traceId().orElse(null)
        );
    }
}
