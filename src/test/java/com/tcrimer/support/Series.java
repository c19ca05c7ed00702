package com.tcrimer.support;

import com.tcrimer.model.Bar;
import com.tcrimer.model.TimeSeries;
import com.tcrimer.model.Timeframe;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Daily test series starting at {@link #START}.
 */
public final class Series {
    public static final Instant START = Instant.parse("2024-01-01T00:00:00Z");

    private Series() {
    }

    public static TimeSeries daily(String symbol, double... closes) {
        List<Bar> bars = new ArrayList<>(closes.length);
        for (int i = 0; i < closes.length; i++) {
            double c = closes[i];
            double prev = i == 0 ? c : closes[i - 1];
            bars.add(new Bar(day(i), prev, Math.max(prev, c) + 0.5, Math.min(prev, c) - 0.5, c, 1000.0 + i));
        }
        return new TimeSeries(symbol, Timeframe.D1, bars);
    }

    /**
     * {@code count} closes rising linearly from {@code from} to {@code to}.
     */
    public static double[] linear(double from, double to, int count) {
        double[] out = new double[count];
        for (int i = 0; i < count; i++) {
            out[i] = count == 1 ? from : from + (to - from) * i / (count - 1);
        }
        return out;
    }

    public static Instant day(int index) {
        return START.plus(Duration.ofDays(index));
    }
}
