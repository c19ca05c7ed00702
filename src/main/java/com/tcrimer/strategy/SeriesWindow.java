package com.tcrimer.strategy;

import com.tcrimer.model.Bar;
import com.tcrimer.model.TimeSeries;

import java.time.Instant;
import java.util.Arrays;

/**
 * Read-only prefix of a series ending at the evaluation bar. Nothing after {@link #last()} is reachable.
 */
public final class SeriesWindow {
    private final TimeSeries series;
    private final double[] allCloses;
    private final int size;

    private SeriesWindow(TimeSeries series, double[] allCloses, int size) {
        this.series = series;
        this.allCloses = allCloses;
        this.size = size;
    }

    /**
     * Window over {@code series[0..endInclusive]}.
     */
    public static SeriesWindow of(TimeSeries series, int endInclusive) {
        return of(series, series.closes(), endInclusive);
    }

    /**
     * Same as {@link #of(TimeSeries, int)} but reuses a close array already extracted from {@code series}.
     */
    public static SeriesWindow of(TimeSeries series, double[] closes, int endInclusive) {
        if (endInclusive < 0 || endInclusive >= series.size()) {
            throw new IndexOutOfBoundsException("window end " + endInclusive + " outside series of " + series.size());
        }
        if (closes.length != series.size()) {
            throw new IllegalArgumentException("close array does not match series " + series.symbol());
        }
        return new SeriesWindow(series, closes, endInclusive + 1);
    }

    public String symbol() {
        return series.symbol();
    }

    public int size() {
        return size;
    }

    public Bar bar(int index) {
        if (index < 0 || index >= size) {
            throw new IndexOutOfBoundsException("bar " + index + " outside window of " + size);
        }
        return series.get(index);
    }

    public Bar last() {
        return series.get(size - 1);
    }

    public Instant timestamp() {
        return last().timestamp;
    }

    /**
     * Closes of the window, oldest first. The returned array is a copy.
     */
    public double[] closes() {
        return Arrays.copyOf(allCloses, size);
    }

    /**
     * Closes of the window without its last bar, i.e. what the previous evaluation saw.
     */
    public double[] previousCloses() {
        return Arrays.copyOf(allCloses, Math.max(0, size - 1));
    }
}
