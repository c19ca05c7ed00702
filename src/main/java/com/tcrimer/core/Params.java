package com.tcrimer.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Named numeric parameters for strategies and indicators, e.g. {@code short=5}.
 * Lookups fail with {@link IllegalArgumentException} on malformed values.
 */
public final class Params {
    private static final Params EMPTY = new Params(Map.of());

    private final Map<String, Double> values;

    private Params(Map<String, Double> values) {
        this.values = Collections.unmodifiableMap(new TreeMap<>(values));
    }

    public static Params empty() {
        return EMPTY;
    }

    public static Params of(Map<String, ? extends Number> raw) {
        if (raw == null || raw.isEmpty()) {
            return EMPTY;
        }
        Map<String, Double> out = new LinkedHashMap<>();
        for (Map.Entry<String, ? extends Number> entry : raw.entrySet()) {
            if (entry.getValue() == null) {
                throw new IllegalArgumentException("parameter " + entry.getKey() + " has no value");
            }
            out.put(normalizeName(entry.getKey()), entry.getValue().doubleValue());
        }
        return new Params(out);
    }

    /**
     * Parses {@code name=value} pairs as given on the command line.
     */
    public static Params parse(Iterable<String> pairs) {
        Map<String, Double> out = new LinkedHashMap<>();
        if (pairs != null) {
            for (String pair : pairs) {
                if (pair == null || pair.isBlank()) {
                    continue;
                }
                int eq = pair.indexOf('=');
                if (eq <= 0 || eq == pair.length() - 1) {
                    throw new IllegalArgumentException("expected name=value, got: " + pair);
                }
                String name = normalizeName(pair.substring(0, eq));
                String value = pair.substring(eq + 1).trim();
                try {
                    out.put(name, Double.parseDouble(value));
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("parameter " + name + " is not a number: " + value);
                }
            }
        }
        return out.isEmpty() ? EMPTY : new Params(out);
    }

    public boolean has(String name) {
        return values.containsKey(normalizeName(name));
    }

    /**
     * A positive whole number, or {@code fallback} when absent.
     */
    public int positiveInt(String name, int fallback) {
        Double raw = values.get(normalizeName(name));
        if (raw == null) {
            return fallback;
        }
        if (raw != Math.rint(raw) || raw <= 0 || raw > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("parameter " + name + " must be a positive integer: " + raw);
        }
        return raw.intValue();
    }

    public double number(String name, double fallback) {
        Double raw = values.get(normalizeName(name));
        if (raw == null) {
            return fallback;
        }
        if (!Double.isFinite(raw)) {
            throw new IllegalArgumentException("parameter " + name + " must be finite: " + raw);
        }
        return raw;
    }

    public Params with(String name, Number value) {
        Map<String, Double> copy = new LinkedHashMap<>(values);
        copy.put(normalizeName(name), value.doubleValue());
        return new Params(copy);
    }

    public Map<String, Double> asMap() {
        return values;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Params other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }

    private static String normalizeName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("blank parameter name");
        }
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
