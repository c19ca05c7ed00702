package com.tcrimer.db;

import com.tcrimer.db.mybatis.BacktestResultMapper;
import com.tcrimer.db.mybatis.BacktestResultRow;
import com.tcrimer.db.mybatis.MetadataMapper;
import com.tcrimer.db.mybatis.MyBatisSupport;
import com.tcrimer.db.pool.BackendTransitionListener;
import com.tcrimer.db.pool.ConnectionPool;
import org.apache.ibatis.exceptions.PersistenceException;
import org.apache.ibatis.session.SqlSession;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Copies rows written to the fallback during an outage back into the primary.
 * <p>
 * Only rows stamped at or after the last successful sync are copied; the marker lives in the
 * fallback's {@code metadata} table. Upserts make a repeated sync harmless.
 */
public final class FallbackReplicator implements BackendTransitionListener {
    private static final Logger log = LogManager.getLogger(FallbackReplicator.class);
    static final String SYNC_MARKER_KEY = "fallback_synced_at";
    private static final int BATCH_SIZE = 500;

    private final ConnectionPool pool;
    private final Clock clock;

    public FallbackReplicator(ConnectionPool pool, Clock clock) {
        this.pool = pool;
        this.clock = clock;
    }

    public record SyncStats(int bars, int backtestResults, Instant since) {
    }

    /**
     * Runs after the selector reverts to PRIMARY. Failures are logged; the next sync picks them up.
     */
    @Override
    public void onFailback() {
        try {
            SyncStats stats = sync();
            log.info("fallback sync after failback bars={} backtest_results={}", stats.bars(), stats.backtestResults());
        } catch (SQLException e) {
            log.error("fallback sync after failback failed, will retry on next sync: {}", e.getMessage());
        }
    }

    public SyncStats sync() throws SQLException {
        Instant startedAt = clock.instant();
        try (Connection fallback = pool.acquire(BackendKind.FALLBACK);
             Connection primary = pool.acquire(BackendKind.PRIMARY);
             SqlSession target = MyBatisSupport.openSession(primary)) {
            long since = readMarker(fallback);
            primary.setAutoCommit(false);
            try {
                int bars = copyBars(fallback, primary, since);
                int results = copyResults(fallback, target, since);
                primary.commit();
                writeMarker(fallback, startedAt);
                return new SyncStats(bars, results, Instant.ofEpochMilli(since));
            } catch (SQLException | RuntimeException e) {
                primary.rollback();
                if (e instanceof PersistenceException pe) {
                    throw MyBatisSupport.toSqlException(pe);
                }
                throw e;
            }
        }
    }

    private int copyBars(Connection fallback, Connection primary, long since) throws SQLException {
        String selectSql = "SELECT symbol, timeframe, ts, open, high, low, close, volume, source, updated_at " +
                "FROM ohlcv_bars WHERE updated_at>=? ORDER BY symbol, timeframe, ts";
        int count = 0;
        int batch = 0;
        try (PreparedStatement select = fallback.prepareStatement(selectSql);
             PreparedStatement insert = primary.prepareStatement(OhlcvDao.UPSERT_SQL)) {
            select.setLong(1, since);
            try (ResultSet rs = select.executeQuery()) {
                while (rs.next()) {
                    insert.setString(1, rs.getString("symbol"));
                    insert.setString(2, rs.getString("timeframe"));
                    insert.setLong(3, rs.getLong("ts"));
                    insert.setDouble(4, rs.getDouble("open"));
                    insert.setDouble(5, rs.getDouble("high"));
                    insert.setDouble(6, rs.getDouble("low"));
                    insert.setDouble(7, rs.getDouble("close"));
                    insert.setDouble(8, rs.getDouble("volume"));
                    insert.setString(9, rs.getString("source"));
                    insert.setLong(10, rs.getLong("updated_at"));
                    insert.addBatch();
                    count++;
                    if (++batch >= BATCH_SIZE) {
                        insert.executeBatch();
                        batch = 0;
                    }
                }
            }
            if (batch > 0) {
                insert.executeBatch();
            }
        }
        return count;
    }

    private int copyResults(Connection fallback, SqlSession target, long since) {
        List<BacktestResultRow> rows;
        try (SqlSession source = MyBatisSupport.openSession(fallback)) {
            rows = source.getMapper(BacktestResultMapper.class).selectCompletedSince(since);
        }
        BacktestResultMapper mapper = target.getMapper(BacktestResultMapper.class);
        for (BacktestResultRow row : rows) {
            mapper.upsert(row);
        }
        return rows.size();
    }

    private long readMarker(Connection fallback) throws SQLException {
        try (PreparedStatement ps = fallback.prepareStatement("SELECT meta_value FROM metadata WHERE meta_key=?")) {
            ps.setString(1, SYNC_MARKER_KEY);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    try {
                        return Long.parseLong(rs.getString(1).trim());
                    } catch (NumberFormatException e) {
                        log.warn("ignoring malformed sync marker value={}", rs.getString(1));
                    }
                }
            }
        }
        return 0L;
    }

    private void writeMarker(Connection fallback, Instant at) {
        try (SqlSession session = MyBatisSupport.openSession(fallback)) {
            session.getMapper(MetadataMapper.class)
                    .upsertValue(SYNC_MARKER_KEY, Long.toString(at.toEpochMilli()), at.toString());
            session.commit();
        }
    }
}
