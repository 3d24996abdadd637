package com.cashflow.simulator.cli;

public class CliUsageException extends RuntimeException {

    public CliUsageException(String message) {
        super(message);
    }

    public CliUsageException(String message, Throwable cause) {
        super(message, cause);
    }
}
