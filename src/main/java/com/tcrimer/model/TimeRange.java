package com.tcrimer.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Closed interval {@code [start, end]}.
 */
public record TimeRange(Instant start, Instant end) {
    public TimeRange {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("range end " + end + " is before start " + start);
        }
    }

    public boolean contains(Instant ts) {
        return !ts.isBefore(start) && !ts.isAfter(end);
    }
}
