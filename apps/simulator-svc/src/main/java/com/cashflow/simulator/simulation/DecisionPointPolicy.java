package com.cashflow.simulator.simulation;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.YearMonth;

/**
 * Which day of a month is evaluated for a surplus sweep. The sweep itself always lands on the
 * first calendar day of the following month.
 */
public enum DecisionPointPolicy {
    LAST_CALENDAR_DAY,
    /** Last Monday to Friday of the month. No holiday calendar is applied. */
    LAST_BUSINESS_DAY;

    public LocalDate decisionDateIn(YearMonth month) {
        LocalDate candidate = month.atEndOfMonth();
        return switch (this) {
            case LAST_CALENDAR_DAY -> candidate;
            case LAST_BUSINESS_DAY -> {
                while (candidate.getDayOfWeek() == DayOfWeek.SATURDAY || candidate.getDayOfWeek() == DayOfWeek.SUNDAY) {
                    candidate = candidate.minusDays(1);
                }
                yield candidate;
            }
        };
    }

    public boolean isDecisionPoint(LocalDate date) {
        return date.isEqual(decisionDateIn(YearMonth.from(date)));
    }

    public static LocalDate transferDateFor(LocalDate decisionDate) {
        return YearMonth.from(decisionDate).plusMonths(1).atDay(1);
    }
}
