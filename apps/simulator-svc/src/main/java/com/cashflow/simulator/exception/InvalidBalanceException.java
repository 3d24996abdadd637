package com.cashflow.simulator.exception;

public class InvalidBalanceException extends SimulationInputException {

    private final String field;

    public InvalidBalanceException(String field, String message) {
        super("INVALID_BALANCE", field + " " + message);
        this.field = field;
    }

    public InvalidBalanceException(String field, String message, Throwable cause) {
        super("INVALID_BALANCE", field + " " + message, cause);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
