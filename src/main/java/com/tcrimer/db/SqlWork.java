package com.tcrimer.db;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Unit of work run by {@link DataStore} on a leased connection. May be run more than once when
 * the store retries a transient failure, so it must not keep state between invocations.
 */
@FunctionalInterface
public interface SqlWork<T> {
    T apply(Connection connection) throws SQLException;
}
