package com.tcrimer.indicator;

import com.tcrimer.core.Outcome;
import com.tcrimer.core.Params;
import com.tcrimer.model.TimeSeries;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Indicators addressable by name, with their default parameters.
 */
public enum IndicatorKind {
    SMA("sma") {
        @Override
        Params defaults() {
            return Params.of(Map.of("period", 20));
        }

        @Override
        Outcome<IndicatorValue> compute(TimeSeries series, Params p) {
            return single(this, series, Indicators.sma(series.closes(), p.positiveInt("period", 20)));
        }
    },
    EMA("ema") {
        @Override
        Params defaults() {
            return Params.of(Map.of("period", 20));
        }

        @Override
        Outcome<IndicatorValue> compute(TimeSeries series, Params p) {
            return single(this, series, Indicators.ema(series.closes(), p.positiveInt("period", 20)));
        }
    },
    RSI("rsi") {
        @Override
        Params defaults() {
            return Params.of(Map.of("period", 14));
        }

        @Override
        Outcome<IndicatorValue> compute(TimeSeries series, Params p) {
            return single(this, series, Indicators.rsi(series.closes(), p.positiveInt("period", 14)));
        }
    },
    MACD("macd") {
        @Override
        Params defaults() {
            return Params.of(Map.of("fast", 12, "slow", 26, "signal", 9));
        }

        @Override
        Outcome<IndicatorValue> compute(TimeSeries series, Params p) {
            Outcome<MacdValue> out = Indicators.macd(series.closes(),
                    p.positiveInt("fast", 12), p.positiveInt("slow", 26), p.positiveInt("signal", 9));
            if (!out.success) {
                return out.castFailure();
            }
            Map<String, Double> components = new LinkedHashMap<>();
            components.put("macd", out.value.macd());
            components.put("signal", out.value.signal());
            components.put("histogram", out.value.histogram());
            return Outcome.success(new IndicatorValue(this, series.symbol(), asOf(series), components), code);
        }
    },
    BOLLINGER("bollinger") {
        @Override
        Params defaults() {
            return Params.of(Map.of("period", 20, "k", 2));
        }

        @Override
        Outcome<IndicatorValue> compute(TimeSeries series, Params p) {
            Outcome<BollingerBand> out = Indicators.bollinger(series.closes(),
                    p.positiveInt("period", 20), p.number("k", 2.0));
            if (!out.success) {
                return out.castFailure();
            }
            Map<String, Double> components = new LinkedHashMap<>();
            components.put("upper", out.value.upper());
            components.put("middle", out.value.middle());
            components.put("lower", out.value.lower());
            return Outcome.success(new IndicatorValue(this, series.symbol(), asOf(series), components), code);
        }
    },
    ATR("atr") {
        @Override
        Params defaults() {
            return Params.of(Map.of("period", 14));
        }

        @Override
        Outcome<IndicatorValue> compute(TimeSeries series, Params p) {
            return single(this, series, Indicators.atr(series.highs(), series.lows(), series.closes(),
                    p.positiveInt("period", 14)));
        }
    };

    final String code;

    IndicatorKind(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    abstract Params defaults();

    /**
     * Latest value over the whole series. Throws {@link IllegalArgumentException} on bad params.
     */
    abstract Outcome<IndicatorValue> compute(TimeSeries series, Params params);

    /**
     * Defaults overlaid with the given params, used as the canonical parameter set in cache keys.
     */
    public Params effectiveParams(Params given) {
        Params merged = defaults();
        if (given != null) {
            for (Map.Entry<String, Double> entry : given.asMap().entrySet()) {
                merged = merged.with(entry.getKey(), entry.getValue());
            }
        }
        return merged;
    }

    public static IndicatorKind fromCode(String raw) {
        String value = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        for (IndicatorKind kind : values()) {
            if (kind.code.equals(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("unknown indicator: " + raw);
    }

    private static Outcome<IndicatorValue> single(IndicatorKind kind, TimeSeries series, Outcome<Double> out) {
        if (!out.success) {
            return out.castFailure();
        }
        return Outcome.success(IndicatorValue.single(kind, series.symbol(), asOf(series), out.value), kind.code);
    }

    private static Instant asOf(TimeSeries series) {
        return series.last().timestamp;
    }
}
