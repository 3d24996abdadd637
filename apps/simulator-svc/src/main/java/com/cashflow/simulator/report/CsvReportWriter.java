package com.cashflow.simulator.report;

import com.cashflow.simulator.model.DayRecord;
import com.cashflow.simulator.model.Transaction;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.springframework.stereotype.Component;

@Component
public class CsvReportWriter {

    static final String[] SIMULATION_HEADERS = {
            "date", "start_balance", "transactions_summary", "net_change", "end_balance", "alert_type"
    };
    static final String[] TRANSACTION_HEADERS = {"date", "amount", "description", "category", "forecast"};

    public void writeSimulation(Path file, List<DayRecord> days) {
        CSVFormat format = CSVFormat.DEFAULT.builder().setHeader(SIMULATION_HEADERS).build();
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(writer, format)) {
            for (DayRecord day : days) {
                printer.printRecord(
                        day.date().toString(),
                        Amounts.format(day.startBalance()),
                        summaryCell(day),
                        Amounts.format(day.netChange()),
                        Amounts.format(day.endBalance()),
                        day.alertType().name()
                );
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write simulation output to " + file, ex);
        }
    }

    static String summaryCell(DayRecord day) {
        if (!day.belowTarget()) {
            return day.transactionsSummary();
        }
        String hint = "SYSTEM: Add funds (" + Amounts.format(day.shortfall()) + ")";
        return day.transactionsSummary().isEmpty() ? hint : day.transactionsSummary() + ", " + hint;
    }

    public void writeTransactions(Path file, List<Transaction> transactions) {
        CSVFormat format = CSVFormat.DEFAULT.builder().setHeader(TRANSACTION_HEADERS).build();
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(writer, format)) {
            for (Transaction tx : transactions) {
                printer.printRecord(
                        tx.date().toString(),
                        Amounts.format(tx.amount()),
                        tx.description(),
                        tx.category(),
                        tx.forecast() ? "1" : "0"
                );
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write transactions to " + file, ex);
        }
    }
}
