package com.cashflow.simulator.exception;

public class LedgerFormatException extends IllegalArgumentException {

    private final long line;

    public LedgerFormatException(long line, String message) {
        super("ledger.csv line " + line + ": " + message);
        this.line = line;
    }

    public LedgerFormatException(long line, String message, Throwable cause) {
        super("ledger.csv line " + line + ": " + message, cause);
        this.line = line;
    }

    public long getLine() {
        return line;
    }
}
