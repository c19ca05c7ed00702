package com.tcrimer.backtest;

import com.tcrimer.model.Timeframe;
import com.tcrimer.model.Trade;
import com.tcrimer.support.Series;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PerformanceMetricsTest {

    @Test
    void totalReturnShouldCompoundTradeReturns() {
        List<Trade> trades = List.of(
                Trade.of(Series.day(0), 100, Series.day(1), 110),
                Trade.of(Series.day(2), 100, Series.day(3), 90));

        PerformanceMetrics metrics = PerformanceMetrics.compute(trades, new double[]{1.0, 1.1, 1.1, 0.99},
                new double[]{100, 110, 100, 90}, Timeframe.D1);

        assertEquals(1.1 * 0.9 - 1.0, metrics.getTotalReturnPct(), 1e-12);
        assertEquals(0.1, metrics.getMaxDrawdownPct(), 1e-12);
        assertEquals(0.5, metrics.getWinRatePct(), 1e-12);
        assertEquals(-0.1, metrics.getMarketReturnPct(), 1e-12);
        assertTrue(metrics.isSharpeDefined());
    }

    @Test
    void sharpeShouldScaleByTradeFrequency() {
        List<Trade> trades = List.of(
                Trade.of(Series.day(0), 100, Series.day(1), 110),
                Trade.of(Series.day(2), 100, Series.day(3), 120));
        double[] closes = new double[365];

        PerformanceMetrics metrics = PerformanceMetrics.compute(trades, new double[]{1.0}, closes, Timeframe.D1);

        double mean = 0.15;
        double sd = Math.sqrt(2 * 0.05 * 0.05);
        assertEquals(mean / sd * Math.sqrt(2.0), metrics.getSharpeRatio(), 1e-9);
    }

    @Test
    void zeroVarianceShouldLeaveSharpeUndefined() {
        List<Trade> trades = List.of(
                Trade.of(Series.day(0), 100, Series.day(1), 110),
                Trade.of(Series.day(2), 100, Series.day(3), 110));

        PerformanceMetrics metrics = PerformanceMetrics.compute(trades, new double[]{1.0, 1.1, 1.21},
                new double[]{100, 110, 121}, Timeframe.D1);

        assertFalse(metrics.isSharpeDefined());
        assertEquals(0.0, metrics.getSharpeRatio(), 0.0);
    }

    @Test
    void noTradesShouldGiveZeros() {
        PerformanceMetrics metrics = PerformanceMetrics.compute(List.of(), new double[]{1.0, 1.0},
                new double[]{100, 105}, Timeframe.D1);

        assertEquals(0.0, metrics.getTotalReturnPct(), 0.0);
        assertEquals(0.0, metrics.getWinRatePct(), 0.0);
        assertEquals(0.05, metrics.getMarketReturnPct(), 1e-12);
    }
}
