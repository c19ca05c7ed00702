package com.tcrimer.db;

import com.tcrimer.model.Bar;
import com.tcrimer.model.TimeRange;
import com.tcrimer.model.TimeSeries;
import com.tcrimer.model.Timeframe;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class OhlcvDao {
    static final String UPSERT_SQL = "INSERT INTO ohlcv_bars(symbol, timeframe, ts, open, high, low, close, volume, source, updated_at) " +
            "VALUES(?, ?, ?, ?, ?, ?, ?, ?, ?, ?) " +
            "ON CONFLICT(symbol, timeframe, ts) DO UPDATE SET " +
            "open=excluded.open, high=excluded.high, low=excluded.low, close=excluded.close, " +
            "volume=excluded.volume, source=excluded.source, updated_at=excluded.updated_at";

    private final DataStore store;
    private final Clock clock;

    public OhlcvDao(DataStore store) {
        this(store, Clock.systemUTC());
    }

    public OhlcvDao(DataStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    /**
     * Inserts or replaces bars atomically.
     *
     * @return number of bars written
     */
    public int upsertBars(String symbol, Timeframe timeframe, List<Bar> bars, String source) throws SQLException {
        if (bars == null || bars.isEmpty()) {
            return 0;
        }
        Instant now = clock.instant();
        List<Object[]> rows = new ArrayList<>(bars.size());
        for (Bar bar : bars) {
            rows.add(new Object[]{
                    symbol, timeframe.code(), bar.timestamp, bar.open, bar.high, bar.low, bar.close, bar.volume,
                    source, now
            });
        }
        store.executeBatch(UPSERT_SQL, rows);
        return rows.size();
    }

    public TimeSeries loadRange(String symbol, Timeframe timeframe, TimeRange range) throws SQLException {
        String sql = "SELECT ts, open, high, low, close, volume FROM ohlcv_bars " +
                "WHERE symbol=? AND timeframe=? AND ts>=? AND ts<=? ORDER BY ts ASC";
        List<Row> rows = store.query(sql, symbol, timeframe.code(), range.start(), range.end());
        return new TimeSeries(symbol, timeframe, toBars(rows));
    }

    /**
     * Most recent {@code limit} bars, oldest first.
     */
    public TimeSeries loadLatest(String symbol, Timeframe timeframe, int limit) throws SQLException {
        String sql = "SELECT ts, open, high, low, close, volume FROM ohlcv_bars " +
                "WHERE symbol=? AND timeframe=? ORDER BY ts DESC LIMIT ?";
        List<Bar> desc = toBars(store.query(sql, symbol, timeframe.code(), Math.max(1, limit)));
        List<Bar> asc = new ArrayList<>(desc.size());
        for (int i = desc.size() - 1; i >= 0; i--) {
            asc.add(desc.get(i));
        }
        return new TimeSeries(symbol, timeframe, asc);
    }

    public Optional<Instant> latestTimestamp(String symbol, Timeframe timeframe) throws SQLException {
        Optional<Row> row = store.queryFirst(
                "SELECT MAX(ts) AS max_ts FROM ohlcv_bars WHERE symbol=? AND timeframe=?", symbol, timeframe.code());
        if (row.isEmpty() || row.get().isNull("max_ts")) {
            return Optional.empty();
        }
        return Optional.of(row.get().getInstant("max_ts"));
    }

    public int count(String symbol, Timeframe timeframe) throws SQLException {
        Optional<Row> row = store.queryFirst(
                "SELECT COUNT(*) AS c FROM ohlcv_bars WHERE symbol=? AND timeframe=?", symbol, timeframe.code());
        return row.map(r -> r.getInt("c")).orElse(0);
    }

    private static List<Bar> toBars(List<Row> rows) {
        List<Bar> bars = new ArrayList<>(rows.size());
        for (Row row : rows) {
            bars.add(new Bar(
                    row.getInstant("ts"),
                    row.getDouble("open"),
                    row.getDouble("high"),
                    row.getDouble("low"),
                    row.getDouble("close"),
                    row.getDouble("volume")
            ));
        }
        return bars;
    }
}
