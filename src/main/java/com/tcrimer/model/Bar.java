package com.tcrimer.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One OHLCV bar. The timestamp is the bar's open time.
 */
public final class Bar {
    public final Instant timestamp;
    public final double open;
    public final double high;
    public final double low;
    public final double close;
    public final double volume;

    public Bar(Instant timestamp, double open, double high, double low, double close, double volume) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.open = open;
        this.high = high;
        this.low = low;
        this.close = close;
        this.volume = volume;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Bar bar)) {
            return false;
        }
        return Double.compare(bar.open, open) == 0
                && Double.compare(bar.high, high) == 0
                && Double.compare(bar.low, low) == 0
                && Double.compare(bar.close, close) == 0
                && Double.compare(bar.volume, volume) == 0
                && timestamp.equals(bar.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, open, high, low, close, volume);
    }

    @Override
    public String toString() {
        return "Bar{" + timestamp + " o=" + open + " h=" + high + " l=" + low + " c=" + close + " v=" + volume + "}";
    }
}
