package com.tcrimer.strategy;

import com.tcrimer.core.Outcome;
import com.tcrimer.indicator.Indicators;
import com.tcrimer.model.PositionState;
import com.tcrimer.model.SignalAction;
import com.tcrimer.model.StrategySignal;

/**
 * BUY when RSI climbs back above the oversold level, SELL when it drops back below the
 * overbought level. Both crossings need the previous bar's RSI.
 */
public final class RsiThresholdStrategy implements Strategy {
    public static final String NAME = "rsi_threshold";

    private final int period;
    private final double overbought;
    private final double oversold;

    public RsiThresholdStrategy(int period, double overbought, double oversold) {
        if (period <= 0) {
            throw new IllegalArgumentException("rsi period must be positive: " + period);
        }
        if (!(oversold > 0.0 && oversold < overbought && overbought < 100.0)) {
            throw new IllegalArgumentException("rsi levels must satisfy 0 < oversold < overbought < 100: "
                    + oversold + "/" + overbought);
        }
        this.period = period;
        this.overbought = overbought;
        this.oversold = oversold;
    }

    @Override
    public String id() {
        return NAME + "(overbought=" + format(overbought) + ",oversold=" + format(oversold) + ",period=" + period + ")";
    }

    @Override
    public int minimumBars() {
        return period + 2;
    }

    @Override
    public StrategySignal evaluate(SeriesWindow window, PositionState position) {
        Outcome<Double> now = Indicators.rsi(window.closes(), period);
        Outcome<Double> prev = Indicators.rsi(window.previousCloses(), period);
        if (!now.success || !prev.success) {
            return StrategySignal.hold(window.timestamp());
        }
        if (prev.value <= oversold && now.value > oversold) {
            return new StrategySignal(window.timestamp(), SignalAction.BUY, (now.value - oversold) / oversold);
        }
        if (prev.value >= overbought && now.value < overbought) {
            return new StrategySignal(window.timestamp(), SignalAction.SELL, (overbought - now.value) / (100.0 - overbought));
        }
        return StrategySignal.hold(window.timestamp());
    }

    private static String format(double value) {
        return value == Math.rint(value) ? Long.toString((long) value) : Double.toString(value);
    }
}
