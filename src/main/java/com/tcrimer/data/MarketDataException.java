package com.tcrimer.data;

/**
 * Upstream market data could not be fetched. {@link #isTimedOut()} separates slow upstreams from
 * failing ones.
 */
public class MarketDataException extends Exception {
    private final String symbol;
    private final boolean timedOut;

    public MarketDataException(String symbol, String message, boolean timedOut) {
        super(message);
        this.symbol = symbol;
        this.timedOut = timedOut;
    }

    public MarketDataException(String symbol, String message, boolean timedOut, Throwable cause) {
        super(message, cause);
        this.symbol = symbol;
        this.timedOut = timedOut;
    }

    public String symbol() {
        return symbol;
    }

    public boolean isTimedOut() {
        return timedOut;
    }
}
