package com.tcrimer.db.pool;

import com.tcrimer.db.BackendKind;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Runs on the first connection opened against a backend, before that connection is handed out.
 * Runs again after the primary comes back from an outage. Must be idempotent.
 */
@FunctionalInterface
public interface BackendInitializer {

    void initialize(BackendKind kind, Connection connection) throws SQLException;

    static BackendInitializer none() {
        return (kind, connection) -> {
        };
    }
}
