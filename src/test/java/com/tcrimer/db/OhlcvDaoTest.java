package com.tcrimer.db;

import com.tcrimer.model.Bar;
import com.tcrimer.model.TimeRange;
import com.tcrimer.model.TimeSeries;
import com.tcrimer.model.Timeframe;
import com.tcrimer.support.Series;
import com.tcrimer.support.TestDatabases;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.SQLException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OhlcvDaoTest {

    @TempDir
    Path tempDir;

    private TestDatabases db;
    private OhlcvDao dao;

    @BeforeEach
    void setUp() {
        db = new TestDatabases(tempDir);
        dao = new OhlcvDao(db.store, db.clock);
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    @Test
    void upsertShouldReplaceExistingBars() throws SQLException {
        TimeSeries series = Series.daily("AAPL", 10, 11, 12, 13, 14);
        dao.upsertBars("AAPL", Timeframe.D1, series.bars(), "test");
        Bar revised = new Bar(Series.day(2), 12, 20, 11, 19.5, 1000);

        dao.upsertBars("AAPL", Timeframe.D1, List.of(revised), "test");

        assertEquals(5, dao.count("AAPL", Timeframe.D1));
        TimeSeries loaded = dao.loadRange("AAPL", Timeframe.D1, new TimeRange(Series.day(0), Series.day(4)));
        assertEquals(5, loaded.size());
        assertEquals(19.5, loaded.bars().get(2).close, 1e-9);
    }

    @Test
    void loadRangeShouldBeInclusiveAndAscending() throws SQLException {
        dao.upsertBars("AAPL", Timeframe.D1, Series.daily("AAPL", 1, 2, 3, 4, 5, 6).bars(), "test");

        TimeSeries loaded = dao.loadRange("AAPL", Timeframe.D1, new TimeRange(Series.day(1), Series.day(3)));

        assertEquals(3, loaded.size());
        assertEquals(Series.day(1), loaded.bars().get(0).timestamp);
        assertEquals(Series.day(3), loaded.bars().get(2).timestamp);
    }

    @Test
    void loadLatestShouldReturnMostRecentBarsOldestFirst() throws SQLException {
        dao.upsertBars("MSFT", Timeframe.D1, Series.daily("MSFT", 1, 2, 3, 4, 5, 6).bars(), "test");

        TimeSeries latest = dao.loadLatest("MSFT", Timeframe.D1, 3);

        assertEquals(3, latest.size());
        assertEquals(4.0, latest.bars().get(0).close, 1e-9);
        assertEquals(6.0, latest.bars().get(2).close, 1e-9);
    }

    @Test
    void latestTimestampShouldBeEmptyForUnknownSymbol() throws SQLException {
        assertTrue(dao.latestTimestamp("NONE", Timeframe.D1).isEmpty());

        dao.upsertBars("IBM", Timeframe.D1, Series.daily("IBM", 1, 2, 3).bars(), "test");

        assertEquals(Series.day(2), dao.latestTimestamp("IBM", Timeframe.D1).orElseThrow());
        assertEquals(0, dao.count("IBM", Timeframe.H1));
    }
}
