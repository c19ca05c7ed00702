package com.tcrimer.indicator;

import com.tcrimer.cache.CacheManager;
import com.tcrimer.cache.CacheSettings;
import com.tcrimer.cache.CacheTier;
import com.tcrimer.cache.ValueSizer;
import com.tcrimer.core.CauseCode;
import com.tcrimer.core.Outcome;
import com.tcrimer.core.Params;
import com.tcrimer.data.MarketDataService;
import com.tcrimer.db.OhlcvDao;
import com.tcrimer.model.Bar;
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
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IndicatorServiceTest {

    @TempDir
    Path tempDir;

    private TestDatabases db;
    private OhlcvDao dao;
    private CacheManager cache;
    private MarketDataService marketData;
    private IndicatorService service;

    @BeforeEach
    void setUp() {
        db = new TestDatabases(tempDir);
        dao = new OhlcvDao(db.store, db.clock);
        cache = new CacheManager(CacheSettings.builder().build(), db.clock, ValueSizer.estimating(), db.sink);
        marketData = new MarketDataService(cache, dao, null, Duration.ofSeconds(1), db.clock);
        service = new IndicatorService(marketData, cache, Timeframe.D1, 50);
    }

    @AfterEach
    void tearDown() {
        marketData.close();
        cache.close();
        db.close();
    }

    @Test
    void smaShouldBeComputedOnceAndCached() throws SQLException {
        dao.upsertBars("AAPL", Timeframe.D1, Series.daily("AAPL", 1, 2, 3, 4, 5, 6, 7, 8).bars(), "test");

        Outcome<IndicatorValue> first = service.getIndicator(IndicatorKind.SMA, "aapl", Params.of(Map.of("period", 5)));
        Outcome<IndicatorValue> second = service.getIndicator(IndicatorKind.SMA, "AAPL", Params.of(Map.of("period", 5)));

        assertTrue(first.success);
        assertEquals(6.0, first.value.value(), 1e-12);
        assertEquals(Series.day(7), first.value.asOf());
        assertEquals(first.value, second.value);
        assertEquals(1, indicatorKeys().size());
        assertTrue(indicatorKeys().get(0).startsWith("sym:AAPL:ind:sma(period=5):"));
    }

    @Test
    void insufficientDataShouldNotBeCached() throws SQLException {
        dao.upsertBars("AAPL", Timeframe.D1, Series.daily("AAPL", 1, 2, 3).bars(), "test");

        Outcome<IndicatorValue> out = service.getIndicator(IndicatorKind.RSI, "AAPL", Params.empty());

        assertEquals(CauseCode.INSUFFICIENT_DATA, out.causeCode);
        assertTrue(indicatorKeys().isEmpty());
    }

    @Test
    void unknownSymbolShouldReportNoBars() {
        Outcome<IndicatorValue> out = service.getIndicator(IndicatorKind.EMA, "NOPE", Params.empty());

        assertFalse(out.success);
        assertEquals(CauseCode.NO_BARS, out.causeCode);
    }

    @Test
    void blankSymbolShouldReportInvalidParams() {
        Outcome<IndicatorValue> blank = service.getIndicator(IndicatorKind.RSI, " ", Params.empty());
        Outcome<IndicatorValue> missing = service.getIndicator(IndicatorKind.SMA, null, Params.empty());

        assertFalse(blank.success);
        assertEquals(CauseCode.INVALID_PARAMS, blank.causeCode);
        assertEquals("symbol must not be blank", blank.details.get("error"));
        assertEquals(CauseCode.INVALID_PARAMS, missing.causeCode);
    }

    @Test
    void badParamsShouldReportInvalidParams() throws SQLException {
        dao.upsertBars("AAPL", Timeframe.D1, Series.daily("AAPL", Series.linear(1, 50, 40)).bars(), "test");

        Outcome<IndicatorValue> zeroPeriod = service.getIndicator(IndicatorKind.SMA, "AAPL", Params.of(Map.of("period", 0)));
        Outcome<IndicatorValue> inverted = service.getIndicator(IndicatorKind.MACD, "AAPL",
                Params.of(Map.of("fast", 30, "slow", 10)));

        assertEquals(CauseCode.INVALID_PARAMS, zeroPeriod.causeCode);
        assertEquals(CauseCode.INVALID_PARAMS, inverted.causeCode);
    }

    @Test
    void macdShouldExposeAllThreeLines() throws SQLException {
        dao.upsertBars("AAPL", Timeframe.D1, Series.daily("AAPL", Series.linear(100, 150, 45)).bars(), "test");

        IndicatorValue value = service.getIndicator(IndicatorKind.MACD, "AAPL", Params.empty()).value;

        assertEquals(List.of("macd", "signal", "histogram"), List.copyOf(value.components().keySet()));
        assertEquals(value.component("macd") - value.component("signal"), value.component("histogram"), 1e-12);
        assertEquals(value.component("macd"), value.value(), 1e-12);
    }

    @Test
    void newBarShouldProduceAFreshValue() throws SQLException {
        dao.upsertBars("AAPL", Timeframe.D1, Series.daily("AAPL", 1, 2, 3, 4, 5).bars(), "test");
        double before = service.getIndicator(IndicatorKind.SMA, "AAPL", Params.of(Map.of("period", 3))).value.value();

        marketData.onNewBar("AAPL", Timeframe.D1, new Bar(Series.day(5), 5, 9, 5, 9, 100));
        double after = service.getIndicator(IndicatorKind.SMA, "AAPL", Params.of(Map.of("period", 3))).value.value();

        assertEquals(4.0, before, 1e-12);
        assertEquals(6.0, after, 1e-12);
    }

    private List<String> indicatorKeys() {
        return cache.keys(CacheTier.MEMORY).stream()
                .filter(k -> k.contains(":ind:"))
                .collect(Collectors.toList());
    }
}
