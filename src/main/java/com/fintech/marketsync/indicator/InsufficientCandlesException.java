package com.fintech.marketsync.indicator;

/**
 * Raised when an indicator window is shorter than the engine minimum.
 * Callers must fetch more history before computing.
 */
public class InsufficientCandlesException extends RuntimeException {

    private final int actual;
    private final int required;

    public InsufficientCandlesException(int actual, int required) {
        super("Indicator window too short: actual=" + actual + ", required=" + required);
        this.actual = actual;
        this.required = required;
    }

    public int getActual() {
        return actual;
    }

    public int getRequired() {
        return required;
    }
}
