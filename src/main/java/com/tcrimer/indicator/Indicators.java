package com.tcrimer.indicator;

import com.tcrimer.core.Outcome;

/**
 * Pure technical indicator functions over close (or high/low/close) arrays.
 * <p>
 * Every function needs a minimum number of points and returns an insufficient-data outcome
 * below it; nothing is zero-filled. EMA uses {@code alpha = 2 / (period + 1)} seeded with the
 * first value. RSI uses Wilder smoothing and is on a 0..100 scale. Drawdown is a fraction.
 */
public final class Indicators {

    private Indicators() {
    }

    public static Outcome<Double> sma(double[] values, int period) {
        requirePeriod(period, "sma");
        if (values == null || values.length < period) {
            return Outcome.insufficient("sma", period, length(values));
        }
        return Outcome.success(smaAt(values, period, values.length), "sma");
    }

    /**
     * Simple moving average of the {@code period} values ending just before {@code endExclusive}.
     * Callers must ensure {@code endExclusive >= period}.
     */
    static double smaAt(double[] values, int period, int endExclusive) {
        double sum = 0.0;
        for (int i = endExclusive - period; i < endExclusive; i++) {
            sum += values[i];
        }
        return sum / period;
    }

    public static Outcome<Double> ema(double[] values, int period) {
        requirePeriod(period, "ema");
        if (values == null || values.length < period) {
            return Outcome.insufficient("ema", period, length(values));
        }
        double[] series = emaSeries(values, period);
        return Outcome.success(series[series.length - 1], "ema");
    }

    /**
     * Full EMA series seeded with {@code values[0]}; element {@code i} only depends on {@code values[0..i]}.
     */
    public static double[] emaSeries(double[] values, int period) {
        requirePeriod(period, "ema");
        double[] out = new double[values.length];
        if (values.length == 0) {
            return out;
        }
        double alpha = 2.0 / (period + 1.0);
        out[0] = values[0];
        for (int i = 1; i < values.length; i++) {
            out[i] = alpha * values[i] + (1.0 - alpha) * out[i - 1];
        }
        return out;
    }

    public static Outcome<Double> rsi(double[] closes, int period) {
        requirePeriod(period, "rsi");
        int required = period + 1;
        if (closes == null || closes.length < required) {
            return Outcome.insufficient("rsi", required, length(closes));
        }
        double gain = 0.0;
        double loss = 0.0;
        for (int i = 1; i <= period; i++) {
            double diff = closes[i] - closes[i - 1];
            if (diff >= 0) {
                gain += diff;
            } else {
                loss -= diff;
            }
        }
        double avgGain = gain / period;
        double avgLoss = loss / period;

        for (int i = period + 1; i < closes.length; i++) {
            double diff = closes[i] - closes[i - 1];
            double currentGain = diff > 0 ? diff : 0.0;
            double currentLoss = diff < 0 ? -diff : 0.0;
            avgGain = (avgGain * (period - 1) + currentGain) / period;
            avgLoss = (avgLoss * (period - 1) + currentLoss) / period;
        }
        if (avgLoss == 0.0 && avgGain == 0.0) {
            return Outcome.success(50.0, "rsi");
        }
        if (avgLoss == 0.0) {
            return Outcome.success(100.0, "rsi");
        }
        double rs = avgGain / avgLoss;
        return Outcome.success(100.0 - (100.0 / (1.0 + rs)), "rsi");
    }

    public static Outcome<MacdValue> macd(double[] closes, int fast, int slow, int signal) {
        requirePeriod(fast, "macd.fast");
        requirePeriod(slow, "macd.slow");
        requirePeriod(signal, "macd.signal");
        if (fast >= slow) {
            throw new IllegalArgumentException("macd fast period must be below slow period: " + fast + " >= " + slow);
        }
        int required = macdMinimum(slow, signal);
        if (closes == null || closes.length < required) {
            return Outcome.insufficient("macd", required, length(closes));
        }
        MacdLines lines = macdLines(closes, fast, slow, signal);
        int last = closes.length - 1;
        return Outcome.success(new MacdValue(lines.macd[last], lines.signal[last]), "macd");
    }

    public static int macdMinimum(int slow, int signal) {
        return slow + signal - 1;
    }

    /**
     * MACD and signal line for every index. Index {@code i} only depends on {@code closes[0..i]}.
     */
    public static MacdLines macdLines(double[] closes, int fast, int slow, int signal) {
        double[] emaFast = emaSeries(closes, fast);
        double[] emaSlow = emaSeries(closes, slow);
        double[] macdLine = new double[closes.length];
        for (int i = 0; i < closes.length; i++) {
            macdLine[i] = emaFast[i] - emaSlow[i];
        }
        return new MacdLines(macdLine, emaSeries(macdLine, signal));
    }

    public static Outcome<BollingerBand> bollinger(double[] closes, int period, double k) {
        requirePeriod(period, "bollinger");
        int required = Math.max(2, period);
        if (closes == null || closes.length < required) {
            return Outcome.insufficient("bollinger", required, length(closes));
        }
        double mean = smaAt(closes, period, closes.length);
        double sumSq = 0.0;
        for (int i = closes.length - period; i < closes.length; i++) {
            double d = closes[i] - mean;
            sumSq += d * d;
        }
        // sample deviation (n - 1)
        double stdev = period > 1 ? Math.sqrt(sumSq / (period - 1)) : 0.0;
        return Outcome.success(new BollingerBand(mean + k * stdev, mean, mean - k * stdev), "bollinger");
    }

    public static Outcome<Double> atr(double[] highs, double[] lows, double[] closes, int period) {
        requirePeriod(period, "atr");
        int required = period + 1;
        if (closes == null || highs == null || lows == null || closes.length < required) {
            return Outcome.insufficient("atr", required, length(closes));
        }
        if (highs.length != closes.length || lows.length != closes.length) {
            throw new IllegalArgumentException("atr inputs must have equal length");
        }
        double sum = 0.0;
        for (int i = closes.length - period; i < closes.length; i++) {
            double prevClose = closes[i - 1];
            double tr1 = highs[i] - lows[i];
            double tr2 = Math.abs(highs[i] - prevClose);
            double tr3 = Math.abs(lows[i] - prevClose);
            sum += Math.max(tr1, Math.max(tr2, tr3));
        }
        return Outcome.success(sum / period, "atr");
    }

    /**
     * Largest peak-to-trough decline of a positive curve, as a fraction in {@code [0, 1]}.
     */
    public static Outcome<Double> maxDrawdown(double[] curve) {
        if (curve == null || curve.length == 0) {
            return Outcome.insufficient("max_drawdown", 1, 0);
        }
        double peak = curve[0];
        double worst = 0.0;
        for (double value : curve) {
            peak = Math.max(peak, value);
            if (peak > 0.0) {
                worst = Math.max(worst, (peak - value) / peak);
            }
        }
        return Outcome.success(worst, "max_drawdown");
    }

    private static void requirePeriod(int period, String name) {
        if (period <= 0) {
            throw new IllegalArgumentException(name + " period must be positive: " + period);
        }
    }

    private static int length(double[] values) {
        return values == null ? 0 : values.length;
    }

    public record MacdLines(double[] macd, double[] signal) {
    }
}
