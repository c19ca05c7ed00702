package com.tcrimer.indicator;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Latest value of one indicator for one series. Single-line indicators expose {@code value};
 * MACD exposes {@code macd, signal, histogram}; Bollinger exposes {@code upper, middle, lower}.
 */
public record IndicatorValue(IndicatorKind kind, String symbol, Instant asOf, Map<String, Double> components) {

    public IndicatorValue {
        components = Collections.unmodifiableMap(new LinkedHashMap<>(components));
    }

    static IndicatorValue single(IndicatorKind kind, String symbol, Instant asOf, double value) {
        return new IndicatorValue(kind, symbol, asOf, Map.of("value", value));
    }

    /**
     * The headline number: {@code value}, or the first component for multi-line indicators.
     */
    public double value() {
        Double single = components.get("value");
        if (single != null) {
            return single;
        }
        return components.values().iterator().next();
    }

    public double component(String name) {
        Double v = components.get(name);
        if (v == null) {
            throw new IllegalArgumentException(kind + " has no component " + name);
        }
        return v;
    }
}
