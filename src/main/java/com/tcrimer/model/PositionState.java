package com.tcrimer.model;

import java.time.Instant;

/**
 * The single open position, if any, that a strategy may look at.
 */
public record PositionState(boolean open, Instant entryTime, double entryPrice) {
    private static final PositionState FLAT = new PositionState(false, null, 0.0);

    public static PositionState flat() {
        return FLAT;
    }

    public static PositionState open(Instant entryTime, double entryPrice) {
        return new PositionState(true, entryTime, entryPrice);
    }
}
