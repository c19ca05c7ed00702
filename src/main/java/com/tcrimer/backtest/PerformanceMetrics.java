package com.tcrimer.backtest;

import com.tcrimer.indicator.Indicators;
import com.tcrimer.model.Timeframe;
import com.tcrimer.model.Trade;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Run-level statistics. All percentages are fractions.
 * <ul>
 *   <li>total return: product of {@code (1 + tradeReturn)} minus one</li>
 *   <li>max drawdown: over the bar-by-bar mark-to-market equity curve</li>
 *   <li>Sharpe: mean over sample deviation of trade returns, scaled by
 *       {@code sqrt(barsPerYear * trades / bars)}; 0 and undefined below two trades or at zero variance</li>
 * </ul>
 */
@Value
@Builder
public class PerformanceMetrics {
    double totalReturnPct;
    double maxDrawdownPct;
    double sharpeRatio;
    boolean sharpeDefined;
    double winRatePct;
    double marketReturnPct;

    public static PerformanceMetrics compute(List<Trade> trades, double[] equityCurve, double[] closes, Timeframe timeframe) {
        double growth = 1.0;
        int wins = 0;
        for (Trade trade : trades) {
            growth *= 1.0 + trade.returnPct();
            if (trade.getPnl() > 0.0) {
                wins++;
            }
        }
        double drawdown = equityCurve.length == 0 ? 0.0 : Indicators.maxDrawdown(equityCurve).value;
        double market = closes.length < 2 || closes[0] == 0.0 ? 0.0 : closes[closes.length - 1] / closes[0] - 1.0;

        PerformanceMetricsBuilder builder = PerformanceMetrics.builder()
                .totalReturnPct(growth - 1.0)
                .maxDrawdownPct(drawdown)
                .winRatePct(trades.isEmpty() ? 0.0 : (double) wins / trades.size())
                .marketReturnPct(market)
                .sharpeRatio(0.0)
                .sharpeDefined(false);

        if (trades.size() >= 2 && closes.length > 0) {
            double mean = 0.0;
            for (Trade trade : trades) {
                mean += trade.returnPct();
            }
            mean /= trades.size();
            double sumSq = 0.0;
            for (Trade trade : trades) {
                double d = trade.returnPct() - mean;
                sumSq += d * d;
            }
            double stdev = Math.sqrt(sumSq / (trades.size() - 1));
            if (stdev > 0.0 && Double.isFinite(stdev)) {
                double tradesPerYear = timeframe.barsPerYear() * trades.size() / closes.length;
                builder.sharpeRatio(mean / stdev * Math.sqrt(tradesPerYear)).sharpeDefined(true);
            }
        }
        return builder.build();
    }
}
