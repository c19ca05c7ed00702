package com.tcrimer.backtest;

import com.tcrimer.model.BacktestResult;
import com.tcrimer.model.Bar;
import com.tcrimer.model.PositionState;
import com.tcrimer.model.StrategySignal;
import com.tcrimer.model.TimeRange;
import com.tcrimer.model.TimeSeries;
import com.tcrimer.model.Trade;
import com.tcrimer.strategy.SeriesWindow;
import com.tcrimer.strategy.Strategy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * Replays one strategy over one series window, bar by bar.
 * <p>
 * Fill model: BUY opens one unit at the bar close when flat, SELL closes it at the bar close,
 * HOLD does nothing. A position still open after the last bar is closed at that bar's close.
 * No leverage, no partial fills, no fees. The runner holds no connection and no shared state,
 * so independent runs can execute in parallel.
 */
public class BacktestRunner {
    private static final Logger log = LogManager.getLogger(BacktestRunner.class);

    private final Clock clock;

    public BacktestRunner(Clock clock) {
        this.clock = clock;
    }

    /**
     * @param cancelled polled between bars
     */
    public BacktestResult run(Strategy strategy, TimeSeries series, TimeRange range, BooleanSupplier cancelled)
            throws BacktestFailedException {
        double[] closes = series.closes();
        List<Integer> inWindow = new ArrayList<>();
        for (int i = 0; i < series.size(); i++) {
            if (range.contains(series.get(i).timestamp)) {
                inWindow.add(i);
            }
        }
        if (inWindow.isEmpty()) {
            throw new BacktestFailedException(BacktestFailedException.Reason.DATA_FAULT,
                    "no bars for " + series.symbol() + " between " + range.start() + " and " + range.end());
        }

        List<Trade> trades = new ArrayList<>();
        double[] equity = new double[inWindow.size()];
        double[] windowCloses = new double[inWindow.size()];
        PositionState position = PositionState.flat();
        double realized = 1.0;

        for (int step = 0; step < inWindow.size(); step++) {
            if (cancelled.getAsBoolean() || Thread.currentThread().isInterrupted()) {
                throw new BacktestFailedException(BacktestFailedException.Reason.CANCELLED,
                        strategy.id() + " on " + series.symbol() + " cancelled at bar " + step + "/" + inWindow.size());
            }
            int index = inWindow.get(step);
            Bar bar = series.get(index);
            StrategySignal signal = strategy.evaluate(SeriesWindow.of(series, closes, index), position);
            switch (signal.action()) {
                case BUY:
                    if (!position.open()) {
                        position = PositionState.open(bar.timestamp, bar.close);
                    }
                    break;
                case SELL:
                    if (position.open()) {
                        Trade trade = Trade.of(position.entryTime(), position.entryPrice(), bar.timestamp, bar.close);
                        trades.add(trade);
                        realized *= 1.0 + trade.returnPct();
                        position = PositionState.flat();
                    }
                    break;
                default:
                    break;
            }
            equity[step] = position.open() && position.entryPrice() != 0.0
                    ? realized * bar.close / position.entryPrice()
                    : realized;
            windowCloses[step] = bar.close;
        }

        Bar lastBar = series.get(inWindow.get(inWindow.size() - 1));
        if (position.open()) {
            trades.add(Trade.of(position.entryTime(), position.entryPrice(), lastBar.timestamp, lastBar.close));
        }

        PerformanceMetrics metrics = PerformanceMetrics.compute(trades, equity, windowCloses, series.timeframe());
        log.debug("backtest done strategy={} symbol={} bars={} trades={} total_return={}",
                strategy.id(), series.symbol(), inWindow.size(), trades.size(), metrics.getTotalReturnPct());
        return BacktestResult.builder()
                .strategyId(strategy.id())
                .symbol(series.symbol())
                .timeframe(series.timeframe())
                .startTime(range.start())
                .endTime(range.end())
                .trades(trades)
                .barCount(inWindow.size())
                .totalReturnPct(metrics.getTotalReturnPct())
                .maxDrawdownPct(metrics.getMaxDrawdownPct())
                .sharpeRatio(metrics.getSharpeRatio())
                .sharpeDefined(metrics.isSharpeDefined())
                .winRatePct(metrics.getWinRatePct())
                .marketReturnPct(metrics.getMarketReturnPct())
                .completedAt(clock.instant())
                .build();
    }
}
