package com.tcrimer.strategy;

import com.tcrimer.core.Outcome;
import com.tcrimer.indicator.Indicators;
import com.tcrimer.model.PositionState;
import com.tcrimer.model.SignalAction;
import com.tcrimer.model.StrategySignal;

/**
 * BUY when the short SMA moves above the long SMA, SELL when it moves below. A previous bar
 * without enough history counts as neither above nor below.
 */
public final class MovingAverageCrossoverStrategy implements Strategy {
    public static final String NAME = "ma_crossover";

    private final int shortPeriod;
    private final int longPeriod;

    public MovingAverageCrossoverStrategy(int shortPeriod, int longPeriod) {
        if (shortPeriod <= 0 || longPeriod <= 0) {
            throw new IllegalArgumentException("moving average periods must be positive: " + shortPeriod + "/" + longPeriod);
        }
        if (shortPeriod >= longPeriod) {
            throw new IllegalArgumentException("short period must be below long period: " + shortPeriod + " >= " + longPeriod);
        }
        this.shortPeriod = shortPeriod;
        this.longPeriod = longPeriod;
    }

    @Override
    public String id() {
        return NAME + "(long=" + longPeriod + ",short=" + shortPeriod + ")";
    }

    @Override
    public int minimumBars() {
        return longPeriod;
    }

    @Override
    public StrategySignal evaluate(SeriesWindow window, PositionState position) {
        double[] now = window.closes();
        Outcome<Double> shortNow = Indicators.sma(now, shortPeriod);
        Outcome<Double> longNow = Indicators.sma(now, longPeriod);
        if (!shortNow.success || !longNow.success) {
            return StrategySignal.hold(window.timestamp());
        }
        double[] before = window.previousCloses();
        Outcome<Double> shortPrev = Indicators.sma(before, shortPeriod);
        Outcome<Double> longPrev = Indicators.sma(before, longPeriod);
        boolean prevKnown = shortPrev.success && longPrev.success;
        boolean wasAbove = prevKnown && shortPrev.value > longPrev.value;
        boolean wasBelow = prevKnown && shortPrev.value < longPrev.value;

        double gap = shortNow.value - longNow.value;
        double confidence = longNow.value == 0.0 ? 0.0 : Math.abs(gap) / Math.abs(longNow.value) * 20.0;
        if (gap > 0 && !wasAbove) {
            return new StrategySignal(window.timestamp(), SignalAction.BUY, confidence);
        }
        if (gap < 0 && !wasBelow) {
            return new StrategySignal(window.timestamp(), SignalAction.SELL, confidence);
        }
        return StrategySignal.hold(window.timestamp());
    }

    public int shortPeriod() {
        return shortPeriod;
    }

    public int longPeriod() {
        return longPeriod;
    }
}
