package com.tcrimer.strategy;

import com.tcrimer.core.Params;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

class StrategyRegistryTest {
    private final StrategyRegistry registry = new StrategyRegistry();

    @Test
    void aliasShouldCreateStrategyWithDefaults() {
        assertEquals("ma_crossover(long=50,short=20)", registry.create("ma", Params.empty()).id());
        assertEquals("rsi_threshold(overbought=70,oversold=30,period=14)", registry.create("RSI", null).id());
        assertEquals("macd_signal(fast=12,signal=9,slow=26)", registry.create("macd_signal", Params.empty()).id());
    }

    @Test
    void canonicalIdShouldRoundTrip() {
        Strategy strategy = registry.create("ma_crossover", Params.of(Map.of("short", 5, "long", 10)));

        Strategy again = registry.create(strategy.id(), Params.empty());

        assertEquals("ma_crossover(long=10,short=5)", strategy.id());
        assertEquals(strategy.id(), again.id());
        assertInstanceOf(MovingAverageCrossoverStrategy.class, again);
    }

    @Test
    void explicitParamsShouldOverrideEmbeddedOnes() {
        Strategy strategy = registry.create("ma_crossover(long=10,short=5)", Params.of(Map.of("short", 3)));

        assertEquals("ma_crossover(long=10,short=3)", strategy.id());
    }

    @Test
    void unknownOrInvalidShouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> registry.create("bollinger_breakout", Params.empty()));
        assertThrows(IllegalArgumentException.class, () -> registry.create(" ", Params.empty()));
        assertThrows(IllegalArgumentException.class, () -> registry.create("ma(short=5", Params.empty()));
        assertThrows(IllegalArgumentException.class,
                () -> registry.create("ma", Params.of(Map.of("short", 50, "long", 20))));
        assertThrows(IllegalArgumentException.class,
                () -> registry.create("rsi", Params.of(Map.of("period", 2.5))));
    }

    @Test
    void presetsShouldCoverEveryStrategyFamily() {
        List<String> ids = registry.presets().stream()
                .map(p -> p.strategy().id())
                .collect(Collectors.toList());

        assertEquals(7, ids.size());
        assertEquals("ma_crossover(long=50,short=20)", ids.get(0));
        assertEquals("rsi_threshold(overbought=75,oversold=25,period=7)", ids.get(4));
        assertEquals("macd_signal(fast=8,signal=9,slow=17)", ids.get(6));
    }

    @Test
    void paramsOfShouldReadCanonicalId() {
        Map<String, Double> params = StrategyRegistry.paramsOf("macd_signal(fast=12,signal=9,slow=26)");

        assertEquals(Map.of("fast", 12.0, "signal", 9.0, "slow", 26.0), params);
        assertEquals(Map.of(), StrategyRegistry.paramsOf("plain"));
    }
}
