package com.tcrimer.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable OHLCV series, strictly increasing by timestamp. Missing bars are simply absent.
 */
public final class TimeSeries {
    private final String symbol;
    private final Timeframe timeframe;
    private final List<Bar> bars;

    public TimeSeries(String symbol, Timeframe timeframe, List<Bar> bars) {
        this.symbol = Objects.requireNonNull(symbol, "symbol");
        this.timeframe = Objects.requireNonNull(timeframe, "timeframe");
        List<Bar> copy = new ArrayList<>(bars == null ? List.of() : bars);
        for (int i = 0; i < copy.size(); i++) {
            Bar bar = copy.get(i);
            if (bar == null) {
                throw new IllegalArgumentException("null bar at index " + i + " for " + symbol);
            }
            if (i > 0 && !bar.timestamp.isAfter(copy.get(i - 1).timestamp)) {
                throw new IllegalArgumentException("bars must be strictly increasing: " + symbol
                        + " index=" + i + " ts=" + bar.timestamp + " prev=" + copy.get(i - 1).timestamp);
            }
        }
        this.bars = Collections.unmodifiableList(copy);
    }

    public static TimeSeries empty(String symbol, Timeframe timeframe) {
        return new TimeSeries(symbol, timeframe, List.of());
    }

    public String symbol() {
        return symbol;
    }

    public Timeframe timeframe() {
        return timeframe;
    }

    public List<Bar> bars() {
        return bars;
    }

    public int size() {
        return bars.size();
    }

    public boolean isEmpty() {
        return bars.isEmpty();
    }

    public Bar get(int index) {
        return bars.get(index);
    }

    public Bar last() {
        if (bars.isEmpty()) {
            throw new IllegalStateException("empty series " + symbol);
        }
        return bars.get(bars.size() - 1);
    }

    public double[] closes() {
        double[] out = new double[bars.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = bars.get(i).close;
        }
        return out;
    }

    public double[] highs() {
        double[] out = new double[bars.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = bars.get(i).high;
        }
        return out;
    }

    public double[] lows() {
        double[] out = new double[bars.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = bars.get(i).low;
        }
        return out;
    }

    /**
     * Bars whose timestamp falls inside the range, as a new series.
     */
    public TimeSeries slice(TimeRange range) {
        List<Bar> out = new ArrayList<>();
        for (Bar bar : bars) {
            if (range.contains(bar.timestamp)) {
                out.add(bar);
            }
        }
        return new TimeSeries(symbol, timeframe, out);
    }

    /**
     * First {@code count} bars as a new series.
     */
    public TimeSeries head(int count) {
        int n = Math.max(0, Math.min(count, bars.size()));
        return new TimeSeries(symbol, timeframe, bars.subList(0, n));
    }

    /**
     * Stable identity of this series content boundary, used in cache keys together with its length.
     */
    public String identity() {
        if (bars.isEmpty()) {
            return symbol + ":" + timeframe.code() + ":empty";
        }
        Instant first = bars.get(0).timestamp;
        Instant lastTs = bars.get(bars.size() - 1).timestamp;
        return symbol + ":" + timeframe.code() + ":" + first.toEpochMilli() + "-" + lastTs.toEpochMilli();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TimeSeries other)) {
            return false;
        }
        return symbol.equals(other.symbol) && timeframe == other.timeframe && bars.equals(other.bars);
    }

    @Override
    public int hashCode() {
        return Objects.hash(symbol, timeframe, bars);
    }

    @Override
    public String toString() {
        return "TimeSeries{" + identity() + ", size=" + bars.size() + "}";
    }
}
