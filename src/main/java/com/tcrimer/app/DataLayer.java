package com.tcrimer.app;

import com.tcrimer.backtest.BacktestService;
import com.tcrimer.cache.CacheManager;
import com.tcrimer.cache.CacheSettings;
import com.tcrimer.cache.ValueSizer;
import com.tcrimer.config.Config;
import com.tcrimer.core.AsyncLogSink;
import com.tcrimer.data.CsvHistoryCollector;
import com.tcrimer.data.MarketDataCollector;
import com.tcrimer.data.MarketDataService;
import com.tcrimer.db.Backend;
import com.tcrimer.db.BacktestResultDao;
import com.tcrimer.db.DataStore;
import com.tcrimer.db.DatabaseMaintenance;
import com.tcrimer.db.FallbackReplicator;
import com.tcrimer.db.OhlcvDao;
import com.tcrimer.db.PostgresBackend;
import com.tcrimer.db.SchemaMigrator;
import com.tcrimer.db.SqliteBackend;
import com.tcrimer.db.pool.BackendSelector;
import com.tcrimer.db.pool.ConnectionPool;
import com.tcrimer.db.pool.PoolSettings;
import com.tcrimer.indicator.IndicatorService;
import com.tcrimer.model.Timeframe;
import com.tcrimer.strategy.StrategyRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;

/**
 * Wires every component from one {@link Config}. Owns their lifecycles; {@link #close()} stops
 * them in reverse order.
 */
public final class DataLayer implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(DataLayer.class);
    private static final int QUERY_STATS_PUBLISHED = 10;

    private final AsyncLogSink events;
    private final BackendSelector selector;
    private final ConnectionPool pool;
    private final DataStore store;
    private final OhlcvDao ohlcvDao;
    private final BacktestResultDao backtestResults;
    private final FallbackReplicator replicator;
    private final DatabaseMaintenance maintenance;
    private final CacheManager cache;
    private final MarketDataService marketData;
    private final IndicatorService indicators;
    private final StrategyRegistry strategies;
    private final BacktestService backtests;

    private DataLayer(Config config, PoolSettings poolSettings, CacheSettings cacheSettings, Backend primary,
                      Backend fallback, MarketDataCollector collector, Clock clock, boolean reconcileInBackground) {
        this.events = new AsyncLogSink(config.getInt("events.queue_capacity"));
        this.selector = new BackendSelector(primary, poolSettings, clock, events);
        this.pool = new ConnectionPool(primary, fallback, selector, poolSettings, new SchemaMigrator(), clock, events);
        this.replicator = new FallbackReplicator(pool, clock);
        selector.addListener(replicator);
        selector.initialize();
        if (reconcileInBackground) {
            selector.startBackgroundReconciliation();
        }

        this.store = DataStore.fromConfig(pool, config);
        this.ohlcvDao = new OhlcvDao(store, clock);
        this.backtestResults = new BacktestResultDao(store);
        this.maintenance = DatabaseMaintenance.fromConfig(store, config, clock, events);
        this.cache = new CacheManager(cacheSettings, clock,
                ValueSizer.estimating(), events);
        this.marketData = new MarketDataService(cache, ohlcvDao, collector,
                Duration.ofSeconds(Math.max(1, config.getLong("upstream.fetch_timeout_seconds"))), clock);
        Timeframe timeframe = Timeframe.fromCode(config.getString("backtest.timeframe"));
        this.indicators = new IndicatorService(marketData, cache, timeframe, config.getInt("indicator.lookback_bars"));
        this.strategies = new StrategyRegistry();
        this.backtests = BacktestService.fromConfig(config, marketData, backtestResults, cache, strategies, clock, events);
        log.info("data layer ready authoritative={} primary={} fallback={}",
                selector.current(), primary.describe(), fallback.describe());
        log.info("config sources db.primary.url={} db.fallback.path={} pool.max_size={} cache.default_ttl_seconds={}",
                config.sourceOf("db.primary.url"), config.sourceOf("db.fallback.path"),
                config.sourceOf("pool.max_size"), config.sourceOf("cache.default_ttl_seconds"));
    }

    /**
     * Production wiring: PostgreSQL primary (env {@code TCRIMER_DB_URL/USER/PASS} over config),
     * SQLite fallback, HTTP CSV collector, background reconciliation.
     */
    public static DataLayer open(Config config, Clock clock) {
        boolean sqlLog = config.getBoolean("db.sql_log.enabled", false);
        Backend primary = new PostgresBackend(
                firstNonBlank(System.getenv("TCRIMER_DB_URL"), config.getString("db.primary.url")),
                firstNonBlank(System.getenv("TCRIMER_DB_USER"), config.getString("db.primary.user")),
                firstNonBlank(System.getenv("TCRIMER_DB_PASS"), config.getString("db.primary.pass")),
                config.getString("db.primary.schema"),
                sqlLog);
        Backend fallback = new SqliteBackend(config.getPath("db.fallback.path"), sqlLog);
        return new DataLayer(config, PoolSettings.fromConfig(config), CacheSettings.fromConfig(config),
                primary, fallback, new CsvHistoryCollector(config), clock, true);
    }

    /**
     * Explicit backends and collector, no background reconciliation.
     */
    public static DataLayer open(Config config, Backend primary, Backend fallback, MarketDataCollector collector,
                                 Clock clock) {
        return new DataLayer(config, PoolSettings.fromConfig(config), CacheSettings.fromConfig(config),
                primary, fallback, collector, clock, false);
    }

    public static DataLayer open(Config config, PoolSettings poolSettings, CacheSettings cacheSettings,
                                 Backend primary, Backend fallback, MarketDataCollector collector, Clock clock,
                                 boolean reconcileInBackground) {
        return new DataLayer(config, poolSettings, cacheSettings, primary, fallback, collector, clock,
                reconcileInBackground);
    }

    public BackendSelector selector() {
        return selector;
    }

    public ConnectionPool pool() {
        return pool;
    }

    public DataStore store() {
        return store;
    }

    public OhlcvDao ohlcvDao() {
        return ohlcvDao;
    }

    public BacktestResultDao backtestResults() {
        return backtestResults;
    }

    public FallbackReplicator replicator() {
        return replicator;
    }

    public DatabaseMaintenance maintenance() {
        return maintenance;
    }

    public CacheManager cache() {
        return cache;
    }

    public MarketDataService marketData() {
        return marketData;
    }

    public IndicatorService indicators() {
        return indicators;
    }

    public StrategyRegistry strategies() {
        return strategies;
    }

    public BacktestService backtests() {
        return backtests;
    }

    public AsyncLogSink events() {
        return events;
    }

    @Override
    public void close() {
        backtests.close();
        marketData.close();
        cache.publishStats();
        store.publishQueryStats(events, QUERY_STATS_PUBLISHED);
        cache.close();
        selector.close();
        pool.close();
        events.close();
    }

    static String firstNonBlank(String... values) {
        if (values == null) {
            return "";
        }
        for (String value : values) {
            if (value == null) {
                continue;
            }
            String trimmed = value.trim();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return "";
    }
}
