package com.cashflow.simulator.simulation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.cashflow.simulator.exception.InvalidBalanceException;
import com.cashflow.simulator.exception.InvalidWindowException;
import com.cashflow.simulator.model.DayRecord;
import com.cashflow.simulator.model.Transaction;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DailyLedgerProjectorTest {

    private DailyLedgerProjector projector;

    private List<Transaction> transactions;

    @BeforeEach
    void setUp() {
        projector = new DailyLedgerProjector();
        transactions = List.of(
                forecast("2024-01-02", "-1500.00", "Rent", "Fixed"),
                forecast("2024-01-05", "2500.00", "Paycheck", "Revenue"),
                forecast("2024-01-05", "-50.00", "Spotify", "Variable"),
                forecast("2024-01-08", "-800.00", "Car Payment", "Fixed")
        );
    }

    @Test
    void keepsBalanceFlatWithoutTransactions() {
        List<DayRecord> days = projector.project(
                new BigDecimal("1000"), new BigDecimal("500"), List.of(), LocalDate.of(2024, 1, 1), 5);

        assertThat(days).hasSize(5);
        assertThat(days).allSatisfy(day -> {
            assertThat(day.netChange()).isEqualByComparingTo("0");
            assertThat(day.endBalance()).isEqualByComparingTo("1000");
            assertThat(day.alertType()).isEqualTo(DayRecord.AlertType.OK);
            assertThat(day.transactionsSummary()).isEmpty();
        });
        assertThat(days.get(4).date()).isEqualTo(LocalDate.of(2024, 1, 5));
    }

    @Test
    void flagsDayThatEndsBelowTarget() {
        List<DayRecord> days = projector.project(
                new BigDecimal("2000"),
                new BigDecimal("1000"),
                List.of(forecast("2024-01-02", "-1500", "Rent", "Fixed")),
                LocalDate.of(2024, 1, 1),
                3
        );

        DayRecord dayTwo = days.get(1);
        assertThat(dayTwo.endBalance()).isEqualByComparingTo("500");
        assertThat(dayTwo.alertType()).isEqualTo(DayRecord.AlertType.BELOW_TARGET);
        assertThat(dayTwo.shortfall()).isEqualByComparingTo("500");
        assertThat(days.get(0).alertType()).isEqualTo(DayRecord.AlertType.OK);
        assertThat(days.get(0).shortfall()).isEqualByComparingTo("0");
    }

    @Test
    void carriesBalancesAcrossDays() {
        List<DayRecord> days = projector.project(
                new BigDecimal("2000.00"), new BigDecimal("1000.00"), transactions, LocalDate.of(2024, 1, 1), 10);

        assertThat(days).hasSize(10);
        DayRecord dayFive = days.get(4);
        assertThat(dayFive.date()).isEqualTo(LocalDate.of(2024, 1, 5));
        assertThat(dayFive.startBalance()).isEqualByComparingTo("500.00");
        assertThat(dayFive.netChange()).isEqualByComparingTo("2450.00");
        assertThat(dayFive.endBalance()).isEqualByComparingTo("2950.00");
        assertThat(dayFive.alertType()).isEqualTo(DayRecord.AlertType.OK);
        assertThat(days.get(9).endBalance()).isEqualByComparingTo("2150.00");

        for (int i = 1; i < days.size(); i++) {
            assertThat(days.get(i).startBalance()).isEqualByComparingTo(days.get(i - 1).endBalance());
        }
    }

    @Test
    void summarizesSameDayTransactionsInInputOrder() {
        List<DayRecord> days = projector.project(
                new BigDecimal("1000.00"), new BigDecimal("500.00"), transactions, LocalDate.of(2024, 1, 5), 1);

        assertThat(days).singleElement().satisfies(day -> {
            assertThat(day.endBalance()).isEqualByComparingTo("3450.00");
            assertThat(day.transactionsSummary()).isEqualTo("Paycheck: 2500.00, Spotify: -50.00");
        });
    }

    @Test
    void ignoresTransactionsOutsideTheWindow() {
        List<DayRecord> days = projector.project(
                new BigDecimal("100"),
                new BigDecimal("0"),
                List.of(
                        forecast("2023-12-31", "-1000", "Before", "Fixed"),
                        forecast("2024-01-04", "-1000", "After", "Fixed")
                ),
                LocalDate.of(2024, 1, 1),
                3
        );

        assertThat(days).extracting(DayRecord::endBalance)
                .allSatisfy(balance -> assertThat(balance).isEqualByComparingTo("100"));
    }

    @Test
    void endingExactlyOnTargetIsNotAnAlert() {
        DayRecord day = projector.projectDay(
                LocalDate.of(2024, 1, 2),
                new BigDecimal("1500"),
                new BigDecimal("1000"),
                List.of(forecast("2024-01-02", "-500", "Insurance", "Fixed")));

        assertThat(day.endBalance()).isEqualByComparingTo("1000");
        assertThat(day.alertType()).isEqualTo(DayRecord.AlertType.OK);
    }

    @Test
    void returnsEqualResultsForRepeatedCalls() {
        List<DayRecord> first = projector.project(
                new BigDecimal("2000"), new BigDecimal("1000"), transactions, LocalDate.of(2024, 1, 1), 10);
        List<DayRecord> second = projector.project(
                new BigDecimal("2000"), new BigDecimal("1000"), transactions, LocalDate.of(2024, 1, 1), 10);

        assertThat(second).isEqualTo(first);
    }

    @Test
    void rejectsNonPositiveWindow() {
        assertThatThrownBy(() -> projector.project(
                BigDecimal.ONE, BigDecimal.ONE, transactions, LocalDate.of(2024, 1, 1), 0))
                .isInstanceOf(InvalidWindowException.class)
                .hasMessageContaining("window_days");
    }

    @Test
    void rejectsMissingBalance() {
        assertThatThrownBy(() -> projector.project(
                null, BigDecimal.ONE, transactions, LocalDate.of(2024, 1, 1), 5))
                .isInstanceOf(InvalidBalanceException.class)
                .hasMessageContaining("start_balance");
    }

    private static Transaction forecast(String date, String amount, String description, String category) {
        return new Transaction(LocalDate.parse(date), new BigDecimal(amount), description, category, true);
    }
}
