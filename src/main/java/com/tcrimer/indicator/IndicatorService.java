package com.tcrimer.indicator;

import com.tcrimer.cache.CacheKeys;
import com.tcrimer.cache.CacheManager;
import com.tcrimer.cache.CacheTier;
import com.tcrimer.core.CauseCode;
import com.tcrimer.core.Outcome;
import com.tcrimer.core.Params;
import com.tcrimer.data.MarketDataException;
import com.tcrimer.data.MarketDataService;
import com.tcrimer.model.TimeSeries;
import com.tcrimer.model.Timeframe;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Latest indicator values for a symbol, memoized by {@code (function, params, series identity,
 * series length)}. Only successful values are cached; a new bar changes the identity so stale
 * values are never served.
 */
public final class IndicatorService {
    private static final Logger log = LogManager.getLogger(IndicatorService.class);

    private final MarketDataService marketData;
    private final CacheManager cache;
    private final Timeframe timeframe;
    private final int lookbackBars;

    public IndicatorService(MarketDataService marketData, CacheManager cache, Timeframe timeframe, int lookbackBars) {
        this.marketData = marketData;
        this.cache = cache;
        this.timeframe = timeframe;
        this.lookbackBars = Math.max(1, lookbackBars);
    }

    public Outcome<IndicatorValue> getIndicator(IndicatorKind kind, String symbol, Params params) {
        String owner = kind.code();
        if (symbol == null || symbol.isBlank()) {
            return Outcome.failure(CauseCode.INVALID_PARAMS, owner, Map.of("error", "symbol must not be blank"));
        }
        Params effective;
        try {
            effective = kind.effectiveParams(params);
        } catch (IllegalArgumentException e) {
            return Outcome.failure(CauseCode.INVALID_PARAMS, owner, Map.of("error", e.getMessage()));
        }

        TimeSeries series;
        try {
            series = marketData.latestSeries(symbol, timeframe, lookbackBars);
        } catch (SQLException e) {
            log.warn("indicator series load failed kind={} symbol={} err={}", owner, symbol, e.getMessage());
            return Outcome.failure(CauseCode.DATA_FAULT, owner, Map.of("error", String.valueOf(e.getMessage())));
        } catch (MarketDataException e) {
            log.warn("indicator upstream failed kind={} symbol={} timed_out={} err={}",
                    owner, symbol, e.isTimedOut(), e.getMessage());
            CauseCode code = e.isTimedOut() ? CauseCode.UPSTREAM_TIMEOUT : CauseCode.DATA_FAULT;
            return Outcome.failure(code, owner, Map.of("error", String.valueOf(e.getMessage())));
        }
        if (series.isEmpty()) {
            return Outcome.failure(CauseCode.NO_BARS, owner, Map.of("symbol", series.symbol()));
        }

        String key = CacheKeys.indicator(series.symbol(), owner, effective.asMap(), series.identity(), series.size());
        IndicatorValue hit = cache.get(key).valueAs(IndicatorValue.class);
        if (hit != null) {
            return Outcome.success(hit, owner);
        }

        Outcome<IndicatorValue> computed;
        try {
            computed = kind.compute(series, effective);
        } catch (IllegalArgumentException e) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("params", effective.toString());
            details.put("error", e.getMessage());
            return Outcome.failure(CauseCode.INVALID_PARAMS, owner, details);
        }
        if (computed.success) {
            cache.put(key, computed.value, null, CacheTier.MEMORY);
        }
        return computed;
    }
}
