package com.tcrimer.db;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.postgresql.ds.PGSimpleDataSource;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Locale;

/**
 * Primary backend backed by PostgreSQL.
 */
public final class PostgresBackend implements Backend {
    private static final Logger log = LogManager.getLogger(PostgresBackend.class);
    private static final Logger SQL_LOG = LogManager.getLogger("SQL");

    private final DataSource dataSource;
    private final String jdbcUrl;
    private final String schema;
    private final boolean sqlLogEnabled;

    public PostgresBackend(String jdbcUrl, String user, String pass, String schema, boolean sqlLogEnabled) {
        if (isBlank(jdbcUrl)) {
            throw new IllegalArgumentException("db.primary.url must not be empty");
        }
        this.jdbcUrl = jdbcUrl.trim();
        if (!this.jdbcUrl.toLowerCase(Locale.ROOT).startsWith("jdbc:postgresql:")) {
            throw new IllegalArgumentException("db.primary.url must be a PostgreSQL JDBC URL (jdbc:postgresql://...)");
        }
        this.schema = normalizeSchema(schema);
        this.sqlLogEnabled = sqlLogEnabled;

        PGSimpleDataSource pg = new PGSimpleDataSource();
        pg.setUrl(this.jdbcUrl);
        if (!isBlank(user)) {
            pg.setUser(user.trim());
        }
        if (pass != null) {
            pg.setPassword(pass);
        }
        pg.setCurrentSchema(this.schema);
        pg.setApplicationName("tcrimer");
        pg.setConnectTimeout(5);
        this.dataSource = pg;
    }

    @Override
    public BackendKind kind() {
        return BackendKind.PRIMARY;
    }

    @Override
    public Connection connect() throws SQLException {
        try {
            Connection raw = dataSource.getConnection();
            try (Statement st = raw.createStatement()) {
                st.execute("CREATE SCHEMA IF NOT EXISTS " + schema);
                st.execute("SET search_path TO " + schema + ", public");
            } catch (SQLException e) {
                raw.close();
                throw e;
            }
            return sqlLogEnabled ? SqlLogProxy.wrapConnection(raw, SQL_LOG) : raw;
        } catch (SQLException e) {
            String details = "primary connect failed: jdbc_url=" + maskedJdbcUrl()
                    + ", schema=" + schema
                    + ", hint=" + classifyConnectFailure(e)
                    + ", cause=" + safe(e.getMessage());
            log.debug(details);
            throw new SQLException(details, e.getSQLState(), e.getErrorCode(), e);
        }
    }

    @Override
    public String describe() {
        return "postgres " + maskedJdbcUrl() + " schema=" + schema;
    }

    public String schema() {
        return schema;
    }

    public String maskedJdbcUrl() {
        String out = jdbcUrl;
        out = out.replaceAll("(?i)(password=)[^&]+", "$1***");
        out = out.replaceAll("(://[^:/@]+:)[^@]+(@)", "$1***$2");
        return out;
    }

    private String normalizeSchema(String raw) {
        String value = isBlank(raw) ? "tcrimer" : raw.trim();
        if (!value.matches("[A-Za-z_][A-Za-z0-9_]*")) {
            throw new IllegalArgumentException("invalid db.primary.schema, allowed pattern: [A-Za-z_][A-Za-z0-9_]*");
        }
        return value;
    }

    private boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    private String classifyConnectFailure(SQLException e) {
        String msg = safe(e == null ? null : e.getMessage()).toLowerCase(Locale.ROOT);
        if (msg.contains("password authentication") || msg.contains("permission denied")) {
            return "auth";
        }
        if (msg.contains("does not exist")) {
            return "missing_database";
        }
        if (msg.contains("connection refused") || msg.contains("timed out")) {
            return "unreachable";
        }
        return "connection_error";
    }

    private String safe(String value) {
        return value == null ? "" : value;
    }
}
