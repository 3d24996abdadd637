package com.cashflow.simulator.simulation;

import com.cashflow.simulator.exception.InvalidBalanceException;
import com.cashflow.simulator.exception.InvalidWindowException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;

/**
 * Input checks shared by the projector and the orchestrator. Every check runs before the first day is projected.
 */
public final class SimulationPreconditions {

    private SimulationPreconditions() {
    }

    public static int requireWindow(int windowDays) {
        if (windowDays <= 0) {
            throw new InvalidWindowException(windowDays);
        }
        return windowDays;
    }

    public static BigDecimal requireBalance(String field, BigDecimal value) {
        if (value == null) {
            throw new InvalidBalanceException(field, "must be provided");
        }
        return value;
    }

    public static LocalDate requireStartDate(LocalDate startDate) {
        if (startDate == null) {
            throw new IllegalArgumentException("start_date must be provided");
        }
        return startDate;
    }

    /**
     * Converts a decoded configuration value into a balance. Accepts numbers and numeric text;
     * rejects missing, blank, non-numeric, NaN and infinite values.
     */
    public static BigDecimal parseBalance(String field, Object raw) {
        if (raw == null) {
            throw new InvalidBalanceException(field, "must be provided");
        }
        if (raw instanceof BigDecimal decimal) {
            return decimal;
        }
        if (raw instanceof Double || raw instanceof Float) {
            double value = ((Number) raw).doubleValue();
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                throw new InvalidBalanceException(field, "must be a finite number but was " + raw);
            }
            return BigDecimal.valueOf(value);
        }
        if (raw instanceof BigInteger integer) {
            return new BigDecimal(integer);
        }
        if (raw instanceof Number number) {
            return BigDecimal.valueOf(number.longValue());
        }
        if (raw instanceof CharSequence text) {
            String trimmed = text.toString().trim();
            if (trimmed.isEmpty()) {
                throw new InvalidBalanceException(field, "must not be blank");
            }
            try {
                return new BigDecimal(trimmed);
            } catch (NumberFormatException ex) {
                throw new InvalidBalanceException(field, "is not numeric: '" + trimmed + "'", ex);
            }
        }
        throw new InvalidBalanceException(field, "has unsupported type " + raw.getClass().getSimpleName());
    }
}
