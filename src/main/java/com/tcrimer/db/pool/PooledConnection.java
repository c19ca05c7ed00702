package com.tcrimer.db.pool;

import com.tcrimer.db.BackendKind;

import java.sql.Connection;
import java.time.Instant;

/**
 * A physical connection owned by {@link ConnectionPool}. Callers see it only through the leased
 * {@link Connection} handle, via {@code connection.unwrap(PooledConnection.class)}.
 */
public final class PooledConnection {
    private final long id;
    private final BackendKind backendKind;
    private final Connection handle;
    private final Instant openedAt;
    private volatile ConnectionState state;
    private volatile Instant lastHealthCheckAt;
    private volatile Instant lastReturnedAt;

    PooledConnection(long id, BackendKind backendKind, Connection handle, Instant openedAt) {
        this.id = id;
        this.backendKind = backendKind;
        this.handle = handle;
        this.openedAt = openedAt;
        this.state = ConnectionState.IN_USE;
        this.lastHealthCheckAt = openedAt;
        this.lastReturnedAt = openedAt;
    }

    public long id() {
        return id;
    }

    public BackendKind backendKind() {
        return backendKind;
    }

    public ConnectionState state() {
        return state;
    }

    public Instant openedAt() {
        return openedAt;
    }

    public Instant lastHealthCheckAt() {
        return lastHealthCheckAt;
    }

    /**
     * The connection is retired when its lease closes and is never handed out again.
     */
    public void markBroken() {
        state = ConnectionState.BROKEN;
    }

    public boolean isBroken() {
        return state == ConnectionState.BROKEN;
    }

    Connection handle() {
        return handle;
    }

    Instant lastReturnedAt() {
        return lastReturnedAt;
    }

    void markInUse() {
        if (state != ConnectionState.BROKEN) {
            state = ConnectionState.IN_USE;
        }
    }

    void markIdle(Instant now) {
        if (state != ConnectionState.BROKEN) {
            state = ConnectionState.IDLE;
            lastReturnedAt = now;
        }
    }

    void markHealthy(Instant now) {
        lastHealthCheckAt = now;
    }

    @Override
    public String toString() {
        return "PooledConnection{" + backendKind + "#" + id + " " + state + "}";
    }
}
