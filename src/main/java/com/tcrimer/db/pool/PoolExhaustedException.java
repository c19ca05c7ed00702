package com.tcrimer.db.pool;

import com.tcrimer.db.BackendKind;

import java.sql.SQLException;

/**
 * No connection became available within the acquire timeout. Never retried by the data layer.
 */
public class PoolExhaustedException extends SQLException {
    private final BackendKind backend;
    private final long waitedMillis;

    public PoolExhaustedException(BackendKind backend, int maxSize, long waitedMillis) {
        super("connection pool exhausted: backend=" + backend + ", max_size=" + maxSize + ", waited_ms=" + waitedMillis);
        this.backend = backend;
        this.waitedMillis = waitedMillis;
    }

    public BackendKind backend() {
        return backend;
    }

    public long waitedMillis() {
        return waitedMillis;
    }
}
