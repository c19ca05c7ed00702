package com.tcrimer.cache;

import com.tcrimer.model.TimeRange;
import com.tcrimer.model.Timeframe;

import java.util.Locale;
import java.util.Map;
import java.util.StringJoiner;
import java.util.TreeMap;

/**
 * Key layout. Everything derived from one symbol shares the {@link #symbolPrefix(String)} so a
 * new bar can drop it all with a single prefix invalidation.
 */
public final class CacheKeys {
    private CacheKeys() {
    }

    public static String symbolPrefix(String symbol) {
        return "sym:" + normalizeSymbol(symbol) + ":";
    }

    public static String series(String symbol, Timeframe timeframe, TimeRange range) {
        return symbolPrefix(symbol) + "series:" + timeframe.code() + ":"
                + range.start().toEpochMilli() + "-" + range.end().toEpochMilli();
    }

    public static String latestSeries(String symbol, Timeframe timeframe, int bars) {
        return symbolPrefix(symbol) + "latest:" + timeframe.code() + ":" + bars;
    }

    /**
     * Indicator memo key: function, canonical params, identity of the input series and its length.
     */
    public static String indicator(String symbol, String function, Map<String, ?> params,
                                   String seriesIdentity, int seriesLength) {
        return symbolPrefix(symbol) + "ind:" + function.toLowerCase(Locale.ROOT) + canonicalParams(params)
                + ":" + seriesIdentity + ":" + seriesLength;
    }

    public static String backtest(String symbol, String strategyId, TimeRange range) {
        return symbolPrefix(symbol) + "bt:" + strategyId + ":"
                + range.start().toEpochMilli() + "-" + range.end().toEpochMilli();
    }

    /**
     * Params sorted by name, e.g. {@code (long=10,short=5)}; empty map gives {@code ()}.
     */
    public static String canonicalParams(Map<String, ?> params) {
        StringJoiner joiner = new StringJoiner(",", "(", ")");
        if (params != null) {
            for (Map.Entry<String, ?> entry : new TreeMap<>(params).entrySet()) {
                joiner.add(entry.getKey() + "=" + formatParam(entry.getValue()));
            }
        }
        return joiner.toString();
    }

    private static String formatParam(Object value) {
        if (value instanceof Double d && d == Math.rint(d) && !Double.isInfinite(d)) {
            return Long.toString(d.longValue());
        }
        return String.valueOf(value);
    }

    private static String normalizeSymbol(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("symbol must not be blank");
        }
        return symbol.trim().toUpperCase(Locale.ROOT);
    }
}
