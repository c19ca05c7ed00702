package com.tcrimer.model;

import java.time.Duration;
import java.util.Locale;

/**
 * Bar frequency. Crypto markets trade around the clock, so a year is 365 days of bars.
 */
public enum Timeframe {
    M1("1m", Duration.ofMinutes(1)),
    M5("5m", Duration.ofMinutes(5)),
    M15("15m", Duration.ofMinutes(15)),
    H1("1h", Duration.ofHours(1)),
    H4("4h", Duration.ofHours(4)),
    D1("1d", Duration.ofDays(1)),
    W1("1w", Duration.ofDays(7));

    private static final double SECONDS_PER_YEAR = 365.0 * 24 * 3600;

    private final String code;
    private final Duration length;

    Timeframe(String code, Duration length) {
        this.code = code;
        this.length = length;
    }

    public String code() {
        return code;
    }

    public Duration length() {
        return length;
    }

    public double barsPerYear() {
        return SECONDS_PER_YEAR / length.getSeconds();
    }

    public static Timeframe fromCode(String raw) {
        String value = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        for (Timeframe tf : values()) {
            if (tf.code.equals(value) || tf.name().equalsIgnoreCase(value)) {
                return tf;
            }
        }
        throw new IllegalArgumentException("unknown timeframe: " + raw);
    }
}
