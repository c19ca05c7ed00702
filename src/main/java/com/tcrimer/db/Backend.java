package com.tcrimer.db;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Source of physical connections for one relational backend.
 */
public interface Backend {

    BackendKind kind();

    /**
     * Opens a new physical connection. Callers own it and must close it.
     */
    Connection connect() throws SQLException;

    /**
     * Printable location with credentials masked.
     */
    String describe();
}
