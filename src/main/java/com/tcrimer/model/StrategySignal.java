package com.tcrimer.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Output of one strategy evaluation step. Confidence is clamped to {@code [0, 1]}.
 */
public record StrategySignal(Instant timestamp, SignalAction action, double confidence) {
    public StrategySignal {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(action, "action");
        if (Double.isNaN(confidence)) {
            confidence = 0.0;
        }
        confidence = Math.max(0.0, Math.min(1.0, confidence));
    }

    public static StrategySignal hold(Instant timestamp) {
        return new StrategySignal(timestamp, SignalAction.HOLD, 0.0);
    }
}
