package com.tcrimer.db;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Embedded fallback backend: one SQLite file on local disk.
 */
public final class SqliteBackend implements Backend {
    private static final Logger SQL_LOG = LogManager.getLogger("SQL");

    private final Path file;
    private final BackendKind kind;
    private final boolean sqlLogEnabled;

    public SqliteBackend(Path file, boolean sqlLogEnabled) {
        this(file, BackendKind.FALLBACK, sqlLogEnabled);
    }

    /**
     * Tests also run SQLite in the PRIMARY role, so the kind is configurable.
     */
    public SqliteBackend(Path file, BackendKind kind, boolean sqlLogEnabled) {
        if (file == null) {
            throw new IllegalArgumentException("db.fallback.path must not be empty");
        }
        this.file = file.toAbsolutePath().normalize();
        this.kind = kind;
        this.sqlLogEnabled = sqlLogEnabled;
    }

    @Override
    public BackendKind kind() {
        return kind;
    }

    @Override
    public Connection connect() throws SQLException {
        Path parent = file.getParent();
        if (parent != null) {
            try {
                Files.createDirectories(parent);
            } catch (IOException e) {
                throw new SQLException("cannot create sqlite directory " + parent + ": " + e.getMessage(), "08001", e);
            }
        }
        Connection raw = DriverManager.getConnection("jdbc:sqlite:" + file);
        try (Statement st = raw.createStatement()) {
            st.execute("PRAGMA busy_timeout = 5000");
            st.execute("PRAGMA journal_mode = WAL");
        } catch (SQLException e) {
            raw.close();
            throw e;
        }
        return sqlLogEnabled ? SqlLogProxy.wrapConnection(raw, SQL_LOG) : raw;
    }

    @Override
    public String describe() {
        return "sqlite " + file;
    }

    public Path file() {
        return file;
    }
}
