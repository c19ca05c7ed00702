package com.tcrimer.backtest;

/**
 * A backtest run ended in FAILED. No partial result exists for the window.
 */
public class BacktestFailedException extends Exception {

    public enum Reason {
        DATA_FAULT,
        CANCELLED,
        INVALID_PARAMS,
        TIMEOUT
    }

    private final Reason reason;

    public BacktestFailedException(Reason reason, String message) {
        super(reason + ": " + message);
        this.reason = reason;
    }

    public BacktestFailedException(Reason reason, String message, Throwable cause) {
        super(reason + ": " + message, cause);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
