package com.tcrimer.strategy;

import com.tcrimer.indicator.Indicators;
import com.tcrimer.model.PositionState;
import com.tcrimer.model.SignalAction;
import com.tcrimer.model.StrategySignal;

/**
 * BUY when the MACD line crosses above its signal line, SELL when it crosses below.
 * Lines are only read once {@code slow + signal - 1} bars exist; before that the previous
 * bar counts as neither above nor below.
 */
public final class MacdSignalStrategy implements Strategy {
    public static final String NAME = "macd_signal";

    private final int fast;
    private final int slow;
    private final int signal;

    public MacdSignalStrategy(int fast, int slow, int signal) {
        if (fast <= 0 || slow <= 0 || signal <= 0) {
            throw new IllegalArgumentException("macd periods must be positive: " + fast + "/" + slow + "/" + signal);
        }
        if (fast >= slow) {
            throw new IllegalArgumentException("macd fast period must be below slow period: " + fast + " >= " + slow);
        }
        this.fast = fast;
        this.slow = slow;
        this.signal = signal;
    }

    @Override
    public String id() {
        return NAME + "(fast=" + fast + ",signal=" + signal + ",slow=" + slow + ")";
    }

    @Override
    public int minimumBars() {
        return Indicators.macdMinimum(slow, signal);
    }

    @Override
    public StrategySignal evaluate(SeriesWindow window, PositionState position) {
        int n = window.size();
        int required = minimumBars();
        if (n < required) {
            return StrategySignal.hold(window.timestamp());
        }
        Indicators.MacdLines lines = Indicators.macdLines(window.closes(), fast, slow, signal);
        double histNow = lines.macd()[n - 1] - lines.signal()[n - 1];
        boolean prevKnown = n - 1 >= required;
        double histPrev = prevKnown ? lines.macd()[n - 2] - lines.signal()[n - 2] : 0.0;
        boolean wasAbove = prevKnown && histPrev > 0;
        boolean wasBelow = prevKnown && histPrev < 0;

        double scale = Math.abs(window.last().close);
        double confidence = scale == 0.0 ? 0.0 : Math.abs(histNow) / scale * 100.0;
        if (histNow > 0 && !wasAbove) {
            return new StrategySignal(window.timestamp(), SignalAction.BUY, confidence);
        }
        if (histNow < 0 && !wasBelow) {
            return new StrategySignal(window.timestamp(), SignalAction.SELL, confidence);
        }
        return StrategySignal.hold(window.timestamp());
    }
}
