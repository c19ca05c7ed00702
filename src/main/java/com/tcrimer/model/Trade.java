package com.tcrimer.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Closed single-unit round trip. {@code pnl} is in price units, {@code returnPct} a fraction.
 */
@Value
@Builder(toBuilder = true)
public class Trade {
    Instant entryTime;
    Instant exitTime;
    double entryPrice;
    double exitPrice;
    double pnl;

    public double returnPct() {
        if (entryPrice == 0.0) {
            return 0.0;
        }
        return exitPrice / entryPrice - 1.0;
    }

    public static Trade of(Instant entryTime, double entryPrice, Instant exitTime, double exitPrice) {
        return new Trade(entryTime, exitTime, entryPrice, exitPrice, exitPrice - entryPrice);
    }
}
