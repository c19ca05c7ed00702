package com.tcrimer.db;

import java.sql.SQLException;

/**
 * Storage failure surfaced after the retry budget, or immediately for non-transient errors.
 */
public class DataAccessException extends SQLException {
    private final boolean transientFailure;
    private final int attempts;

    public DataAccessException(String message, SQLException cause, boolean transientFailure, int attempts) {
        super(message, cause == null ? null : cause.getSQLState(), cause == null ? 0 : cause.getErrorCode(), cause);
        this.transientFailure = transientFailure;
        this.attempts = attempts;
    }

    public boolean isTransient() {
        return transientFailure;
    }

    public int attempts() {
        return attempts;
    }
}
