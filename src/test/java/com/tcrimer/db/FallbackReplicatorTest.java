package com.tcrimer.db;

import com.tcrimer.model.BacktestResult;
import com.tcrimer.model.Timeframe;
import com.tcrimer.support.Series;
import com.tcrimer.support.TestDatabases;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FallbackReplicatorTest {

    @TempDir
    Path tempDir;

    private TestDatabases db;
    private OhlcvDao bars;
    private BacktestResultDao results;
    private FallbackReplicator replicator;

    @BeforeEach
    void setUp() throws SQLException {
        db = new TestDatabases(tempDir);
        bars = new OhlcvDao(db.store, db.clock);
        results = new BacktestResultDao(db.store);
        replicator = new FallbackReplicator(db.pool, db.clock);
        // touch the primary so its schema exists before the outage
        assertEquals(0, bars.count("AAPL", Timeframe.D1));
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    @Test
    void syncShouldCopyOutageWritesOnceIntoPrimary() throws SQLException {
        writeDuringOutage();
        db.clock.advance(Duration.ofMinutes(1));

        FallbackReplicator.SyncStats first = replicator.sync();
        db.clock.advance(Duration.ofMinutes(1));
        FallbackReplicator.SyncStats second = replicator.sync();

        assertEquals(3, first.bars());
        assertEquals(1, first.backtestResults());
        assertEquals(0, second.bars());
        assertEquals(0, second.backtestResults());

        db.clock.advance(Duration.ofMinutes(5));
        assertTrue(db.selector.tryReconcile());
        assertEquals(BackendKind.PRIMARY, db.store.authoritative());
        assertEquals(3, bars.count("AAPL", Timeframe.D1));
        assertEquals(1, results.count());
    }

    @Test
    void failbackShouldTriggerSync() throws SQLException {
        db.selector.addListener(replicator);
        writeDuringOutage();
        db.clock.advance(Duration.ofMinutes(5));

        assertTrue(db.selector.tryReconcile());

        assertEquals(BackendKind.PRIMARY, db.store.authoritative());
        assertEquals(3, bars.count("AAPL", Timeframe.D1));
        assertEquals(1, results.count());
    }

    @Test
    void rowsWrittenAfterASyncShouldBeCopiedByTheNext() throws SQLException {
        writeDuringOutage();
        db.clock.advance(Duration.ofMinutes(1));
        replicator.sync();

        db.clock.advance(Duration.ofMinutes(1));
        bars.upsertBars("AAPL", Timeframe.D1, Series.daily("AAPL", 1, 2, 3, 4).bars().subList(3, 4), "test");
        FallbackReplicator.SyncStats next = replicator.sync();

        assertEquals(1, next.bars());
        assertEquals(0, next.backtestResults());
    }

    private void writeDuringOutage() throws SQLException {
        db.selector.failover("outage");
        assertEquals(BackendKind.FALLBACK, db.store.authoritative());
        bars.upsertBars("AAPL", Timeframe.D1, Series.daily("AAPL", 100, 101, 102).bars(), "test");
        results.save(BacktestResult.builder()
                .strategyId("ma_crossover(long=10,short=5)")
                .symbol("AAPL")
                .timeframe(Timeframe.D1)
                .startTime(Series.day(0))
                .endTime(Series.day(2))
                .barCount(3)
                .completedAt(db.clock.instant())
                .build(), Map.of("short", 5, "long", 10));
    }
}
