package com.tcrimer.db.pool;

import com.tcrimer.db.BackendKind;

import java.sql.SQLException;

/**
 * The acquiring thread was interrupted while waiting for a connection. Says nothing about the
 * backend's health, so it never counts toward failover and is never retried.
 */
public class AcquireInterruptedException extends SQLException {
    private final BackendKind backend;

    public AcquireInterruptedException(BackendKind backend, InterruptedException cause) {
        super("interrupted while waiting for a " + backend + " connection", cause);
        this.backend = backend;
    }

    public BackendKind backend() {
        return backend;
    }
}
