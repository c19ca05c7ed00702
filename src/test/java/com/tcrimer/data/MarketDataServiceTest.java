package com.tcrimer.data;

import com.tcrimer.cache.CacheKeys;
import com.tcrimer.cache.CacheManager;
import com.tcrimer.cache.CacheSettings;
import com.tcrimer.cache.ValueSizer;
import com.tcrimer.db.OhlcvDao;
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
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MarketDataServiceTest {
    private static final TimeRange RANGE = new TimeRange(Series.day(0), Series.day(9));

    @TempDir
    Path tempDir;

    private TestDatabases db;
    private OhlcvDao dao;
    private CacheManager cache;
    private FakeCollector collector;
    private MarketDataService service;

    @BeforeEach
    void setUp() {
        db = new TestDatabases(tempDir);
        dao = new OhlcvDao(db.store, db.clock);
        cache = new CacheManager(CacheSettings.builder().build(), db.clock, ValueSizer.estimating(), db.sink);
        collector = new FakeCollector();
        service = new MarketDataService(cache, dao, collector, Duration.ofMillis(200), db.clock);
    }

    @AfterEach
    void tearDown() {
        service.close();
        cache.close();
        db.close();
    }

    @Test
    void storedBarsShouldBeServedWithoutUpstream() throws Exception {
        dao.upsertBars("AAPL", Timeframe.D1, Series.daily("AAPL", 1, 2, 3, 4).bars(), "test");

        TimeSeries first = service.getSeries("aapl", Timeframe.D1, RANGE);
        TimeSeries second = service.getSeries("AAPL", Timeframe.D1, RANGE);

        assertEquals(4, first.size());
        assertEquals(first, second);
        assertEquals(0, collector.seriesCalls.get());
        assertEquals(1L, cache.stats().getHits());
    }

    @Test
    void missingBarsShouldBeFetchedPersistedAndCached() throws Exception {
        TimeSeries first = service.getSeries("MSFT", Timeframe.D1, RANGE);
        TimeSeries second = service.getSeries("MSFT", Timeframe.D1, RANGE);

        assertEquals(10, first.size());
        assertEquals(first, second);
        assertEquals(1, collector.seriesCalls.get());
        assertEquals(10, dao.count("MSFT", Timeframe.D1));
    }

    @Test
    void slowUpstreamShouldFailAsTimedOut() {
        collector.delayMillis = 2_000L;

        MarketDataException e = assertThrows(MarketDataException.class,
                () -> service.getSeries("SLOW", Timeframe.D1, RANGE));

        assertTrue(e.isTimedOut());
        assertEquals("SLOW", e.symbol());
    }

    @Test
    void failingUpstreamShouldNotBeReportedAsTimeout() {
        collector.failure = new MarketDataException("BAD", "http status=500", false);

        MarketDataException e = assertThrows(MarketDataException.class,
                () -> service.getSeries("BAD", Timeframe.D1, RANGE));

        assertFalse(e.isTimedOut());
        assertFalse(cache.get(CacheKeys.series("BAD", Timeframe.D1, RANGE)).hit());
    }

    @Test
    void newBarShouldInvalidateCachedSeriesOfThatSymbol() throws Exception {
        dao.upsertBars("AAPL", Timeframe.D1, Series.daily("AAPL", 1, 2, 3).bars(), "test");
        dao.upsertBars("IBM", Timeframe.D1, Series.daily("IBM", 1, 2, 3).bars(), "test");
        service.getSeries("AAPL", Timeframe.D1, RANGE);
        service.getSeries("IBM", Timeframe.D1, RANGE);

        service.onNewBar("AAPL", Timeframe.D1, new Bar(Series.day(3), 3, 4, 2, 3.5, 10));

        assertFalse(cache.get(CacheKeys.series("AAPL", Timeframe.D1, RANGE)).hit());
        assertTrue(cache.get(CacheKeys.series("IBM", Timeframe.D1, RANGE)).hit());
        assertEquals(4, service.getSeries("AAPL", Timeframe.D1, RANGE).size());
    }

    @Test
    void latestSeriesShouldKeepOnlyTheRequestedTail() throws Exception {
        dao.upsertBars("AAPL", Timeframe.D1, Series.daily("AAPL", 1, 2, 3, 4, 5, 6).bars(), "test");

        TimeSeries latest = service.latestSeries("AAPL", Timeframe.D1, 4);

        assertEquals(4, latest.size());
        assertEquals(6.0, latest.last().close, 1e-9);
    }

    @Test
    void fetchLatestWithoutCollectorShouldFail() {
        MarketDataService offline = new MarketDataService(cache, dao, null, Duration.ofMillis(200), db.clock);

        assertThrows(MarketDataException.class, () -> offline.fetchLatest("AAPL"));
        offline.close();
    }

    private static final class FakeCollector implements MarketDataCollector {
        final AtomicInteger seriesCalls = new AtomicInteger();
        volatile long delayMillis;
        volatile MarketDataException failure;

        @Override
        public TimeSeries fetchSeries(String symbol, Timeframe timeframe, TimeRange range) throws MarketDataException {
            seriesCalls.incrementAndGet();
            if (delayMillis > 0) {
                try {
                    Thread.sleep(delayMillis);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new MarketDataException(symbol, "interrupted", false, e);
                }
            }
            if (failure != null) {
                throw failure;
            }
            return Series.daily(symbol, Series.linear(100, 120, 15)).slice(range);
        }

        @Override
        public Bar fetchLatest(String symbol) {
            return Series.daily(symbol, 1, 2).last();
        }

        @Override
        public String sourceName() {
            return "fake";
        }
    }
}
