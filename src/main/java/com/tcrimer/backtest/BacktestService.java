package com.tcrimer.backtest;

import com.tcrimer.cache.CacheKeys;
import com.tcrimer.cache.CacheManager;
import com.tcrimer.cache.CacheTier;
import com.tcrimer.config.Config;
import com.tcrimer.core.MonitoringEvent;
import com.tcrimer.core.MonitoringSink;
import com.tcrimer.core.Params;
import com.tcrimer.data.MarketDataException;
import com.tcrimer.data.MarketDataService;
import com.tcrimer.db.BacktestResultDao;
import com.tcrimer.model.BacktestResult;
import com.tcrimer.model.TimeRange;
import com.tcrimer.model.TimeSeries;
import com.tcrimer.model.Timeframe;
import com.tcrimer.strategy.Strategy;
import com.tcrimer.strategy.StrategyRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point for running backtests on a worker pool.
 * <p>
 * A result already stored for the same {@code (strategyId, symbol, start, end)} is returned
 * without rerunning. New results are persisted and cached for the session. Every run
 * publishes one {@link MonitoringEvent#BACKTEST_OUTCOME} event.
 */
public final class BacktestService implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(BacktestService.class);

    private final MarketDataService marketData;
    private final BacktestResultDao results;
    private final CacheManager cache;
    private final StrategyRegistry registry;
    private final BacktestRunner runner;
    private final Timeframe timeframe;
    private final Duration runTimeout;
    private final MonitoringSink sink;
    private final ExecutorService workers;

    public BacktestService(MarketDataService marketData, BacktestResultDao results, CacheManager cache,
                           StrategyRegistry registry, Timeframe timeframe, int workerCount, Duration runTimeout,
                           Clock clock, MonitoringSink sink) {
        this.marketData = marketData;
        this.results = results;
        this.cache = cache;
        this.registry = registry;
        this.runner = new BacktestRunner(clock);
        this.timeframe = timeframe;
        this.runTimeout = runTimeout;
        this.sink = sink == null ? MonitoringSink.noop() : sink;
        AtomicInteger seq = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(Math.max(1, workerCount), r -> {
            Thread t = new Thread(r, "tcrimer-backtest-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public static BacktestService fromConfig(Config config, MarketDataService marketData, BacktestResultDao results,
                                             CacheManager cache, StrategyRegistry registry, Clock clock,
                                             MonitoringSink sink) {
        return new BacktestService(marketData, results, cache, registry,
                Timeframe.fromCode(config.getString("backtest.timeframe")),
                config.getInt("backtest.workers"),
                Duration.ofSeconds(Math.max(1, config.getLong("backtest.run_timeout_seconds"))),
                clock, sink);
    }

    /**
     * Runs (or re-displays) a backtest and waits up to the configured run timeout.
     */
    public BacktestResult runBacktest(String strategyId, String symbol, Instant start, Instant end, Params params)
            throws BacktestFailedException {
        return submit(strategyId, symbol, start, end, params).await(runTimeout);
    }

    public BacktestHandle submit(String strategyId, String symbol, Instant start, Instant end, Params params) {
        String normalized = symbol == null ? "" : symbol.trim().toUpperCase(Locale.ROOT);
        BacktestHandle handle = new BacktestHandle(strategyId, normalized);
        handle.attach(workers.submit(() -> execute(handle, strategyId, normalized, start, end, params)));
        return handle;
    }

    public Duration runTimeout() {
        return runTimeout;
    }

    @Override
    public void close() {
        workers.shutdownNow();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("backtest workers did not stop within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private BacktestResult execute(BacktestHandle handle, String strategyId, String symbol, Instant start, Instant end,
                                   Params params) throws BacktestFailedException {
        long began = System.nanoTime();
        if (!handle.markRunning()) {
            throw new BacktestFailedException(BacktestFailedException.Reason.CANCELLED, strategyId + " on " + symbol);
        }
        try {
            BacktestResult result = compute(handle, strategyId, symbol, start, end, params);
            handle.markCompleted();
            publish(handle, result, null, began);
            return result;
        } catch (BacktestFailedException e) {
            handle.markFailed(e.reason());
            publish(handle, null, e, began);
            log.warn("backtest failed strategy={} symbol={} reason={} msg={}", strategyId, symbol, e.reason(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            BacktestFailedException failure = new BacktestFailedException(BacktestFailedException.Reason.DATA_FAULT,
                    "unexpected error: " + e, e);
            handle.markFailed(failure.reason());
            publish(handle, null, failure, began);
            log.error("backtest crashed strategy={} symbol={} err={}", strategyId, symbol, e.toString(), e);
            throw failure;
        }
    }

    private BacktestResult compute(BacktestHandle handle, String strategyId, String symbol, Instant start, Instant end,
                                   Params params) throws BacktestFailedException {
        if (symbol.isEmpty() || start == null || end == null) {
            throw new BacktestFailedException(BacktestFailedException.Reason.INVALID_PARAMS,
                    "symbol, start and end are required");
        }
        Strategy strategy;
        try {
            strategy = registry.create(strategyId, params);
        } catch (IllegalArgumentException e) {
            throw new BacktestFailedException(BacktestFailedException.Reason.INVALID_PARAMS, e.getMessage(), e);
        }
        TimeRange range;
        try {
            range = new TimeRange(start, end);
        } catch (IllegalArgumentException e) {
            throw new BacktestFailedException(BacktestFailedException.Reason.INVALID_PARAMS, e.getMessage(), e);
        }

        String cacheKey = CacheKeys.backtest(symbol, strategy.id(), range);
        BacktestResult cached = cache.get(cacheKey).valueAs(BacktestResult.class);
        if (cached != null) {
            return cached;
        }
        Optional<BacktestResult> stored;
        try {
            stored = results.find(strategy.id(), symbol, start, end);
        } catch (SQLException e) {
            throw new BacktestFailedException(BacktestFailedException.Reason.DATA_FAULT,
                    "stored result lookup failed: " + e.getMessage(), e);
        }
        if (stored.isPresent()) {
            log.info("backtest re-display strategy={} symbol={} completed_at={}",
                    strategy.id(), symbol, stored.get().getCompletedAt());
            cache.put(cacheKey, stored.get(), null, CacheTier.SESSION);
            return stored.get();
        }

        TimeSeries series;
        try {
            series = marketData.getSeries(symbol, timeframe, range);
        } catch (SQLException e) {
            throw new BacktestFailedException(BacktestFailedException.Reason.DATA_FAULT,
                    "series load failed: " + e.getMessage(), e);
        } catch (MarketDataException e) {
            throw new BacktestFailedException(BacktestFailedException.Reason.DATA_FAULT,
                    "upstream series fetch failed" + (e.isTimedOut() ? " (timed out)" : "") + ": " + e.getMessage(), e);
        }

        BacktestResult result = runner.run(strategy, series, range, handle::isCancelRequested);
        try {
            results.save(result, StrategyRegistry.paramsOf(strategy.id()));
        } catch (SQLException e) {
            log.warn("backtest result not persisted strategy={} symbol={} err={}", strategy.id(), symbol, e.getMessage());
        }
        cache.put(cacheKey, result, null, CacheTier.SESSION);
        return result;
    }

    private void publish(BacktestHandle handle, BacktestResult result, BacktestFailedException failure, long began) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("strategy", result == null ? handle.strategyId() : result.getStrategyId());
        fields.put("symbol", handle.symbol());
        fields.put("state", handle.state().name());
        fields.put("elapsed_ms", TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - began));
        if (result != null) {
            fields.put("bars", result.getBarCount());
            fields.put("trades", result.getTrades().size());
            fields.put("total_return", result.getTotalReturnPct());
            fields.put("max_drawdown", result.getMaxDrawdownPct());
        }
        if (failure != null) {
            BacktestFailedException.Reason reason = handle.failureReason();
            fields.put("reason", (reason == null ? failure.reason() : reason).name());
        }
        sink.publish(MonitoringEvent.of(MonitoringEvent.BACKTEST_OUTCOME, fields));
    }
}
