package com.tcrimer.db;

import com.tcrimer.config.Config;
import com.tcrimer.core.MonitoringEvent;
import com.tcrimer.core.MonitoringSink;
import com.tcrimer.db.pool.AcquireInterruptedException;
import com.tcrimer.db.pool.ConnectionPool;
import com.tcrimer.db.pool.PoolExhaustedException;
import com.tcrimer.db.pool.PooledConnection;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Backend-agnostic query and write interface over the connection pool.
 * <p>
 * Statements must run unchanged on PostgreSQL and SQLite. Transient failures are retried with
 * exponential backoff up to {@code maxAttempts}, then surface as {@link DataAccessException};
 * anything else surfaces on the first failure. {@link PoolExhaustedException} and
 * {@link AcquireInterruptedException} are passed through untouched. Bind parameters: {@link Instant}
 * as epoch millis, {@link Boolean} as 0/1, enums by name.
 */
public final class DataStore {
    private static final Logger log = LogManager.getLogger(DataStore.class);

    private final ConnectionPool pool;
    private final int maxAttempts;
    private final long backoffMillis;
    private final long slowQueryMillis;
    private final QueryStats queryStats = new QueryStats();

    public DataStore(ConnectionPool pool, int maxAttempts, long backoffMillis) {
        this(pool, maxAttempts, backoffMillis, 1000L);
    }

    /**
     * @param slowQueryMillis statements slower than this are logged at WARN; zero or negative disables
     */
    public DataStore(ConnectionPool pool, int maxAttempts, long backoffMillis, long slowQueryMillis) {
        this.pool = pool;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.backoffMillis = Math.max(0L, backoffMillis);
        this.slowQueryMillis = slowQueryMillis;
    }

    public static DataStore fromConfig(ConnectionPool pool, Config config) {
        return new DataStore(pool, config.getInt("datastore.max_attempts"), config.getLong("datastore.backoff_ms"),
                config.getLong("datastore.slow_query_ms"));
    }

    public List<Row> query(String sql, Object... params) throws SQLException {
        return timed(sql, () -> withConnection(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                bind(ps, params);
                try (ResultSet rs = ps.executeQuery()) {
                    return readRows(rs);
                }
            }
        }));
    }

    public Optional<Row> queryFirst(String sql, Object... params) throws SQLException {
        List<Row> rows = query(sql, params);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public int execute(String sql, Object... params) throws SQLException {
        return timed(sql, () -> withConnection(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                bind(ps, params);
                return ps.executeUpdate();
            }
        }));
    }

    /**
     * Runs one statement per parameter row inside a single transaction: all rows apply or none do.
     */
    public int executeBatch(String sql, List<Object[]> paramRows) throws SQLException {
        if (paramRows == null || paramRows.isEmpty()) {
            return 0;
        }
        return timed(sql, () -> inTransaction(conn -> {
            int total = 0;
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                for (Object[] params : paramRows) {
                    bind(ps, params);
                    ps.addBatch();
                }
                for (int count : ps.executeBatch()) {
                    total += Math.max(0, count);
                }
            }
            return total;
        }));
    }

    /**
     * Runs {@code work} with auto-commit off and commits when it returns. Any failure rolls back
     * before it propagates; a transient failure reruns the whole unit of work.
     */
    public <T> T inTransaction(SqlWork<T> work) throws SQLException {
        return runWithRetry("transaction", conn -> {
            boolean previous = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try {
                T out = work.apply(conn);
                conn.commit();
                return out;
            } catch (SQLException | RuntimeException e) {
                rollback(conn, e);
                throw e;
            } finally {
                restoreAutoCommit(conn, previous);
            }
        });
    }

    public <T> T withConnection(SqlWork<T> work) throws SQLException {
        return runWithRetry("statement", work);
    }

    public ConnectionPool pool() {
        return pool;
    }

    public BackendKind authoritative() {
        return pool.authoritative();
    }

    /**
     * Counters for {@link #query}, {@link #execute} and {@link #executeBatch}, slowest average first.
     * Retries are part of one execution.
     */
    public List<QueryStat> queryStats() {
        return queryStats.snapshot();
    }

    /**
     * One {@code QUERY_STATS} event per statement, for the {@code limit} slowest statements.
     */
    public void publishQueryStats(MonitoringSink sink, int limit) {
        List<QueryStat> stats = queryStats.snapshot();
        for (QueryStat stat : stats.subList(0, Math.min(Math.max(0, limit), stats.size()))) {
            Map<String, Object> fields = stat.toFields();
            fields.put("backend", authoritative().name());
            sink.publish(MonitoringEvent.of(MonitoringEvent.QUERY_STATS, fields));
        }
    }

    public void resetQueryStats() {
        queryStats.reset();
    }

    private <T> T timed(String sql, StatementCall<T> call) throws SQLException {
        long started = System.nanoTime();
        try {
            T out = call.run();
            record(sql, started, null);
            return out;
        } catch (SQLException | RuntimeException e) {
            record(sql, started, e);
            throw e;
        }
    }

    private void record(String sql, long startedNanos, Throwable error) {
        long elapsed = System.nanoTime() - startedNanos;
        queryStats.record(sql, elapsed, error);
        long elapsedMs = elapsed / 1_000_000L;
        if (slowQueryMillis > 0L && elapsedMs > slowQueryMillis) {
            log.warn("slow statement elapsed_ms={} threshold_ms={} sql={}",
                    elapsedMs, slowQueryMillis, QueryStats.normalize(sql));
        }
    }

    @FunctionalInterface
    private interface StatementCall<T> {
        T run() throws SQLException;
    }

    private <T> T runWithRetry(String label, SqlWork<T> work) throws SQLException {
        SQLException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try (Connection conn = pool.acquire()) {
                try {
                    return work.apply(conn);
                } catch (SQLException e) {
                    if (SqlErrors.isConnectionFailure(e)) {
                        markBroken(conn);
                    }
                    throw e;
                }
            } catch (PoolExhaustedException | AcquireInterruptedException | DataAccessException e) {
                throw e;
            } catch (SQLException e) {
                if (!SqlErrors.isTransient(e)) {
                    throw new DataAccessException(label + " failed: " + e.getMessage(), e, false, attempt);
                }
                last = e;
                if (attempt < maxAttempts) {
                    long delay = backoffMillis * (1L << (attempt - 1));
                    log.warn("transient {} failure attempt={}/{} retry_in_ms={} state={} err={}",
                            label, attempt, maxAttempts, delay, e.getSQLState(), e.getMessage());
                    sleep(delay, e);
                }
            }
        }
        throw new DataAccessException(label + " failed after " + maxAttempts + " attempts: "
                + last.getMessage(), last, true, maxAttempts);
    }

    static void bind(PreparedStatement ps, Object[] params) throws SQLException {
        if (params == null) {
            return;
        }
        for (int i = 0; i < params.length; i++) {
            Object value = params[i];
            int idx = i + 1;
            if (value == null) {
                ps.setNull(idx, Types.NULL);
            } else if (value instanceof Instant instant) {
                ps.setLong(idx, instant.toEpochMilli());
            } else if (value instanceof Boolean flag) {
                ps.setInt(idx, flag ? 1 : 0);
            } else if (value instanceof Enum<?> e) {
                ps.setString(idx, e.name());
            } else if (value instanceof Double d) {
                ps.setDouble(idx, d);
            } else if (value instanceof Long l) {
                ps.setLong(idx, l);
            } else if (value instanceof Integer n) {
                ps.setInt(idx, n);
            } else if (value instanceof String s) {
                ps.setString(idx, s);
            } else {
                ps.setObject(idx, value);
            }
        }
    }

    static List<Row> readRows(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        int columns = meta.getColumnCount();
        String[] labels = new String[columns];
        for (int c = 0; c < columns; c++) {
            labels[c] = meta.getColumnLabel(c + 1).toLowerCase(Locale.ROOT);
        }
        List<Row> rows = new ArrayList<>();
        while (rs.next()) {
            Map<String, Object> values = new LinkedHashMap<>();
            for (int c = 0; c < columns; c++) {
                values.put(labels[c], rs.getObject(c + 1));
            }
            rows.add(new Row(values));
        }
        return rows;
    }

    private void rollback(Connection conn, Exception cause) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
            markBroken(conn);
        }
    }

    private void restoreAutoCommit(Connection conn, boolean previous) {
        try {
            if (!conn.isClosed() && conn.getAutoCommit() != previous) {
                conn.setAutoCommit(previous);
            }
        } catch (SQLException e) {
            log.debug("restore auto-commit failed: {}", e.getMessage());
            markBroken(conn);
        }
    }

    private void markBroken(Connection conn) {
        try {
            if (conn.isWrapperFor(PooledConnection.class)) {
                conn.unwrap(PooledConnection.class).markBroken();
            }
        } catch (SQLException e) {
            log.debug("cannot unwrap pooled connection: {}", e.getMessage());
        }
    }

    private void sleep(long millis, SQLException pending) throws DataAccessException {
        if (millis <= 0L) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DataAccessException("interrupted during retry backoff", pending, true, 0);
        }
    }
}
