package com.tcrimer.strategy;

import com.tcrimer.model.PositionState;
import com.tcrimer.model.StrategySignal;

/**
 * A stateless trading rule. Implementations must be safe to share between concurrent runs.
 */
public interface Strategy {

    /**
     * Canonical id including parameters, e.g. {@code ma_crossover(long=10,short=5)}.
     */
    String id();

    /**
     * Bars needed before the rule can emit anything other than HOLD.
     */
    int minimumBars();

    StrategySignal evaluate(SeriesWindow window, PositionState position);
}
