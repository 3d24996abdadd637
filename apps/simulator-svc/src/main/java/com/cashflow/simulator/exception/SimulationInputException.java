package com.cashflow.simulator.exception;

/**
 * Raised when a projection or simulation is called with arguments it cannot run on.
 * Always thrown before any day is projected.
 */
public class SimulationInputException extends IllegalArgumentException {

    private final String code;

    protected SimulationInputException(String code, String message) {
        super(message);
        this.code = code;
    }

    protected SimulationInputException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
