package com.tcrimer.strategy;

import com.tcrimer.core.Params;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds strategies from a name plus parameters and knows the preset line-up.
 * <p>
 * Accepted names: {@code ma_crossover} ({@code ma}), {@code rsi_threshold} ({@code rsi}) and
 * {@code macd_signal} ({@code macd}). A canonical id such as {@code ma_crossover(long=10,short=5)}
 * is accepted too; explicit params win over the ones embedded in the id.
 */
public final class StrategyRegistry {

    private static final Map<String, String> ALIASES = Map.of(
            "ma", MovingAverageCrossoverStrategy.NAME,
            "ma_crossover", MovingAverageCrossoverStrategy.NAME,
            "rsi", RsiThresholdStrategy.NAME,
            "rsi_threshold", RsiThresholdStrategy.NAME,
            "macd", MacdSignalStrategy.NAME,
            "macd_signal", MacdSignalStrategy.NAME
    );

    private final List<Preset> presets;

    public StrategyRegistry() {
        List<Preset> list = new ArrayList<>();
        list.add(new Preset("MA Crossover (20,50)", new MovingAverageCrossoverStrategy(20, 50)));
        list.add(new Preset("MA Crossover (10,30)", new MovingAverageCrossoverStrategy(10, 30)));
        list.add(new Preset("MA Crossover (5,20)", new MovingAverageCrossoverStrategy(5, 20)));
        list.add(new Preset("RSI (14)", new RsiThresholdStrategy(14, 70, 30)));
        list.add(new Preset("RSI (7)", new RsiThresholdStrategy(7, 75, 25)));
        list.add(new Preset("MACD (12,26,9)", new MacdSignalStrategy(12, 26, 9)));
        list.add(new Preset("MACD (8,17,9)", new MacdSignalStrategy(8, 17, 9)));
        this.presets = Collections.unmodifiableList(list);
    }

    public List<Preset> presets() {
        return presets;
    }

    /**
     * @throws IllegalArgumentException for an unknown name or parameters the strategy rejects
     */
    public Strategy create(String nameOrId, Params params) {
        if (nameOrId == null || nameOrId.isBlank()) {
            throw new IllegalArgumentException("strategy name must not be blank");
        }
        String raw = nameOrId.trim().toLowerCase(Locale.ROOT);
        Params merged = Params.empty();
        int open = raw.indexOf('(');
        if (open >= 0) {
            if (!raw.endsWith(")")) {
                throw new IllegalArgumentException("malformed strategy id: " + nameOrId);
            }
            merged = Params.parse(splitArgs(raw.substring(open + 1, raw.length() - 1)));
            raw = raw.substring(0, open).trim();
        }
        if (params != null) {
            for (Map.Entry<String, Double> entry : params.asMap().entrySet()) {
                merged = merged.with(entry.getKey(), entry.getValue());
            }
        }
        String name = ALIASES.get(raw);
        if (name == null) {
            throw new IllegalArgumentException("unknown strategy: " + nameOrId + " (known: " + names() + ")");
        }
        switch (name) {
            case MovingAverageCrossoverStrategy.NAME:
                return new MovingAverageCrossoverStrategy(
                        merged.positiveInt("short", 20), merged.positiveInt("long", 50));
            case RsiThresholdStrategy.NAME:
                return new RsiThresholdStrategy(merged.positiveInt("period", 14),
                        merged.number("overbought", 70), merged.number("oversold", 30));
            case MacdSignalStrategy.NAME:
                return new MacdSignalStrategy(merged.positiveInt("fast", 12),
                        merged.positiveInt("slow", 26), merged.positiveInt("signal", 9));
            default:
                throw new IllegalArgumentException("unknown strategy: " + nameOrId);
        }
    }

    public List<String> names() {
        return List.of(MovingAverageCrossoverStrategy.NAME, RsiThresholdStrategy.NAME, MacdSignalStrategy.NAME);
    }

    /**
     * Parameters embedded in a canonical id, for persisting alongside a result.
     */
    public static Map<String, Double> paramsOf(String canonicalId) {
        int open = canonicalId.indexOf('(');
        if (open < 0 || !canonicalId.endsWith(")")) {
            return Map.of();
        }
        return new LinkedHashMap<>(Params.parse(splitArgs(canonicalId.substring(open + 1, canonicalId.length() - 1))).asMap());
    }

    private static List<String> splitArgs(String inner) {
        List<String> out = new ArrayList<>();
        for (String part : inner.split(",")) {
            if (!part.isBlank()) {
                out.add(part.trim());
            }
        }
        return out;
    }

    public record Preset(String label, Strategy strategy) {
    }
}
