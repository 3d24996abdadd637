package com.cashflow.simulator.exception;

public class InvalidWindowException extends SimulationInputException {

    private final int windowDays;

    public InvalidWindowException(int windowDays) {
        super("INVALID_WINDOW", "window_days must be positive but was " + windowDays);
        this.windowDays = windowDays;
    }

    public int getWindowDays() {
        return windowDays;
    }
}
