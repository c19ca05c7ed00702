package com.tcrimer.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Completed backtest. Positions are single-unit notional: no leverage, no partial fills,
 * fills at the bar close. Percentages are fractions ({@code 0.05} is five percent).
 * When {@link #isSharpeDefined()} is false the Sharpe ratio is reported as {@code 0.0}.
 */
@Value
@Builder(toBuilder = true)
public class BacktestResult {
    String strategyId;
    String symbol;
    Timeframe timeframe;
    Instant startTime;
    Instant endTime;
    @Singular
    List<Trade> trades;
    int barCount;
    double totalReturnPct;
    double maxDrawdownPct;
    double sharpeRatio;
    boolean sharpeDefined;
    double winRatePct;
    double marketReturnPct;
    Instant completedAt;
}
