package com.tcrimer.db;

import com.tcrimer.db.pool.BackendInitializer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.List;

/**
 * Idempotent schema for both backends. Runs on the first connection the pool opens per backend.
 */
public final class SchemaMigrator implements BackendInitializer {
    private static final Logger log = LogManager.getLogger(SchemaMigrator.class);

    public static final int SCHEMA_VERSION = 1;
    static final String VERSION_KEY = "schema_version";

    private static final List<String> STATEMENTS = List.of(
            "CREATE TABLE IF NOT EXISTS metadata (" +
                    "meta_key TEXT PRIMARY KEY," +
                    "meta_value TEXT NOT NULL," +
                    "updated_at TEXT NOT NULL" +
                    ")",
            "CREATE TABLE IF NOT EXISTS ohlcv_bars (" +
                    "symbol TEXT NOT NULL," +
                    "timeframe TEXT NOT NULL," +
                    "ts BIGINT NOT NULL," +
                    "open DOUBLE PRECISION NOT NULL," +
                    "high DOUBLE PRECISION NOT NULL," +
                    "low DOUBLE PRECISION NOT NULL," +
                    "close DOUBLE PRECISION NOT NULL," +
                    "volume DOUBLE PRECISION NOT NULL," +
                    "source TEXT NULL," +
                    "updated_at BIGINT NOT NULL," +
                    "PRIMARY KEY (symbol, timeframe, ts)" +
                    ")",
            "CREATE INDEX IF NOT EXISTS idx_ohlcv_bars_updated ON ohlcv_bars(updated_at)",
            "CREATE TABLE IF NOT EXISTS backtest_results (" +
                    "strategy_id TEXT NOT NULL," +
                    "symbol TEXT NOT NULL," +
                    "start_ts BIGINT NOT NULL," +
                    "end_ts BIGINT NOT NULL," +
                    "timeframe TEXT NOT NULL," +
                    "params_json TEXT NOT NULL," +
                    "total_return DOUBLE PRECISION NOT NULL," +
                    "max_drawdown DOUBLE PRECISION NOT NULL," +
                    "sharpe_ratio DOUBLE PRECISION NOT NULL," +
                    "sharpe_defined INTEGER NOT NULL," +
                    "win_rate DOUBLE PRECISION NOT NULL," +
                    "market_return DOUBLE PRECISION NOT NULL," +
                    "bar_count INTEGER NOT NULL," +
                    "trade_count INTEGER NOT NULL," +
                    "trades_json TEXT NOT NULL," +
                    "completed_at BIGINT NOT NULL," +
                    "PRIMARY KEY (strategy_id, symbol, start_ts, end_ts)" +
                    ")",
            "CREATE INDEX IF NOT EXISTS idx_backtest_results_symbol ON backtest_results(symbol)",
            "CREATE INDEX IF NOT EXISTS idx_backtest_results_completed ON backtest_results(completed_at)"
    );

    @Override
    public void initialize(BackendKind kind, Connection conn) throws SQLException {
        String lastSql = "";
        int currentVersion = 0;
        try (Statement st = conn.createStatement()) {
            for (String sql : STATEMENTS) {
                lastSql = sql;
                st.execute(sql);
            }
            currentVersion = readSchemaVersion(conn);
            if (currentVersion < SCHEMA_VERSION) {
                writeSchemaVersion(conn, SCHEMA_VERSION);
                log.info("schema migrated backend={} from_version={} to_version={}", kind, currentVersion, SCHEMA_VERSION);
            }
        } catch (SQLException e) {
            String detail = "migration_failed: backend=" + kind
                    + ", schema_version=" + currentVersion
                    + ", target_version=" + SCHEMA_VERSION
                    + ", failed_sql=" + summarize(lastSql)
                    + ", cause=" + e.getMessage();
            log.error(detail);
            throw new SQLException(detail, e.getSQLState(), e.getErrorCode(), e);
        }
    }

    static int readSchemaVersion(Connection conn) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT meta_value FROM metadata WHERE meta_key = ?")) {
            ps.setString(1, VERSION_KEY);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    try {
                        return Integer.parseInt(rs.getString(1).trim());
                    } catch (NumberFormatException e) {
                        return 0;
                    }
                }
            }
        }
        return 0;
    }

    private void writeSchemaVersion(Connection conn, int version) throws SQLException {
        String sql = "INSERT INTO metadata(meta_key, meta_value, updated_at) VALUES(?, ?, ?) " +
                "ON CONFLICT(meta_key) DO UPDATE SET meta_value=excluded.meta_value, updated_at=excluded.updated_at";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, VERSION_KEY);
            ps.setString(2, Integer.toString(version));
            ps.setString(3, Instant.now().toString());
            ps.executeUpdate();
        }
    }

    private static String summarize(String sql) {
        String normalized = sql == null ? "" : sql.replaceAll("\\s+", " ").trim();
        return normalized.length() <= 160 ? normalized : normalized.substring(0, 160) + "...";
    }
}
