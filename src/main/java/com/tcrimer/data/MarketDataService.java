package com.tcrimer.data;

import com.tcrimer.cache.CacheKeys;
import com.tcrimer.cache.CacheManager;
import com.tcrimer.cache.CacheTier;
import com.tcrimer.db.OhlcvDao;
import com.tcrimer.model.Bar;
import com.tcrimer.model.TimeRange;
import com.tcrimer.model.TimeSeries;
import com.tcrimer.model.Timeframe;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Historical series behind the cache: cache, then the relational store, then the upstream
 * collector. Upstream results are persisted before they are cached.
 */
public final class MarketDataService implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(MarketDataService.class);

    private final CacheManager cache;
    private final OhlcvDao dao;
    private final MarketDataCollector collector;
    private final Duration fetchTimeout;
    private final Clock clock;
    private final ExecutorService upstream;

    /**
     * @param collector null for offline operation from stored bars only
     */
    public MarketDataService(CacheManager cache, OhlcvDao dao, MarketDataCollector collector,
                             Duration fetchTimeout, Clock clock) {
        this.cache = cache;
        this.dao = dao;
        this.collector = collector;
        this.fetchTimeout = fetchTimeout;
        this.clock = clock;
        this.upstream = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "tcrimer-upstream");
            t.setDaemon(true);
            return t;
        });
    }

    public TimeSeries getSeries(String symbol, Timeframe timeframe, TimeRange range)
            throws SQLException, MarketDataException {
        String normalized = normalize(symbol);
        String key = CacheKeys.series(normalized, timeframe, range);
        return cached(key, () -> loadSeries(normalized, timeframe, range));
    }

    /**
     * The most recent {@code bars} bars, oldest first.
     */
    public TimeSeries latestSeries(String symbol, Timeframe timeframe, int bars)
            throws SQLException, MarketDataException {
        String normalized = normalize(symbol);
        String key = CacheKeys.latestSeries(normalized, timeframe, bars);
        return cached(key, () -> {
            TimeSeries stored = dao.loadLatest(normalized, timeframe, bars);
            if (!stored.isEmpty() || collector == null) {
                return stored;
            }
            Instant end = clock.instant();
            Instant start = end.minus(timeframe.length().multipliedBy(Math.max(1, bars)));
            TimeSeries fetched = fetchAndStore(normalized, timeframe, new TimeRange(start, end));
            int from = Math.max(0, fetched.size() - bars);
            return new TimeSeries(normalized, timeframe, fetched.bars().subList(from, fetched.size()));
        });
    }

    public Bar fetchLatest(String symbol) throws MarketDataException {
        String normalized = normalize(symbol);
        if (collector == null) {
            throw new MarketDataException(normalized, "no upstream collector configured", false);
        }
        return cache.getOrLoad(CacheKeys.symbolPrefix(normalized) + "latest-bar", Bar.class, CacheTier.MEMORY, null,
                () -> withTimeout(normalized, () -> collector.fetchLatest(normalized)));
    }

    /**
     * Persists a freshly closed bar and drops every cached series and indicator of the symbol.
     */
    public void onNewBar(String symbol, Timeframe timeframe, Bar bar) throws SQLException {
        String normalized = normalize(symbol);
        dao.upsertBars(normalized, timeframe, List.of(bar), collector == null ? "live" : collector.sourceName());
        int dropped = cache.invalidatePrefix(CacheKeys.symbolPrefix(normalized));
        log.debug("new bar symbol={} ts={} invalidated_keys={}", normalized, bar.timestamp, dropped);
    }

    /**
     * Bulk load, e.g. a CSV import. Same invalidation as {@link #onNewBar}.
     */
    public int ingest(TimeSeries series, String source) throws SQLException {
        String normalized = normalize(series.symbol());
        int written = dao.upsertBars(normalized, series.timeframe(), series.bars(), source);
        cache.invalidatePrefix(CacheKeys.symbolPrefix(normalized));
        return written;
    }

    @Override
    public void close() {
        upstream.shutdownNow();
    }

    private TimeSeries cached(String key, SeriesLoader loader) throws SQLException, MarketDataException {
        TimeSeries hit = cache.get(key).valueAs(TimeSeries.class);
        if (hit != null) {
            return hit;
        }
        TimeSeries loaded = loader.load();
        cache.put(key, loaded, null, CacheTier.MEMORY);
        return loaded;
    }

    private TimeSeries loadSeries(String symbol, Timeframe timeframe, TimeRange range)
            throws SQLException, MarketDataException {
        TimeSeries stored = dao.loadRange(symbol, timeframe, range);
        if (!stored.isEmpty() || collector == null) {
            return stored;
        }
        log.info("series miss in store, fetching upstream symbol={} timeframe={} range={}..{}",
                symbol, timeframe.code(), range.start(), range.end());
        return fetchAndStore(symbol, timeframe, range);
    }

    private TimeSeries fetchAndStore(String symbol, Timeframe timeframe, TimeRange range)
            throws SQLException, MarketDataException {
        TimeSeries fetched = withTimeout(symbol, () -> collector.fetchSeries(symbol, timeframe, range));
        if (!fetched.isEmpty()) {
            dao.upsertBars(symbol, timeframe, fetched.bars(), collector.sourceName());
        }
        return new TimeSeries(symbol, timeframe, fetched.bars());
    }

    private <T> T withTimeout(String symbol, Callable<T> call) throws MarketDataException {
        Future<T> future = upstream.submit(call);
        try {
            return future.get(fetchTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new MarketDataException(symbol, "upstream fetch timed out after " + fetchTimeout.toMillis() + "ms", true, e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new MarketDataException(symbol, "interrupted waiting for upstream", false, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof MarketDataException mde) {
                throw mde;
            }
            throw new MarketDataException(symbol, "upstream fetch failed: " + cause, false, cause);
        }
    }

    @FunctionalInterface
    private interface SeriesLoader {
        TimeSeries load() throws SQLException, MarketDataException;
    }

    private static String normalize(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("symbol must not be blank");
        }
        return symbol.trim().toUpperCase(Locale.ROOT);
    }
}
