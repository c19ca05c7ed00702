package com.tcrimer.cache;

import com.tcrimer.model.BacktestResult;
import com.tcrimer.model.TimeSeries;

import java.util.Collection;
import java.util.Map;

/**
 * Approximate retained size of a cached value, used for the byte bound of each tier.
 */
@FunctionalInterface
public interface ValueSizer {

    long sizeOf(Object value);

    static ValueSizer estimating() {
        return ValueSizer::estimate;
    }

    private static long estimate(Object value) {
        if (value == null) {
            return 16L;
        }
        if (value instanceof TimeSeries series) {
            return 96L + 64L * series.size();
        }
        if (value instanceof BacktestResult result) {
            return 256L + 96L * result.getTrades().size();
        }
        if (value instanceof CharSequence text) {
            return 40L + 2L * text.length();
        }
        if (value instanceof Number || value instanceof Boolean) {
            return 16L;
        }
        if (value instanceof double[] array) {
            return 16L + 8L * array.length;
        }
        if (value instanceof Collection<?> items) {
            long total = 32L;
            for (Object item : items) {
                total += estimate(item);
            }
            return total;
        }
        if (value instanceof Map<?, ?> map) {
            long total = 48L;
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                total += 32L + estimate(entry.getKey()) + estimate(entry.getValue());
            }
            return total;
        }
        return 64L;
    }
}
