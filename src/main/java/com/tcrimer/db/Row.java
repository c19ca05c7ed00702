package com.tcrimer.db;

import java.time.Instant;
import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * One result row keyed by lower-case column label. Numeric accessors accept whatever numeric type
 * the backend returned, since SQLite and PostgreSQL widen differently.
 */
public final class Row {
    private final Map<String, Object> values;

    Row(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public Object get(String column) {
        return values.get(key(column));
    }

    public boolean isNull(String column) {
        return get(column) == null;
    }

    public String getString(String column) {
        Object value = get(column);
        return value == null ? null : value.toString();
    }

    public long getLong(String column) {
        Object value = get(column);
        if (value instanceof Number n) {
            return n.longValue();
        }
        return value == null ? 0L : Long.parseLong(value.toString().trim());
    }

    public int getInt(String column) {
        return (int) getLong(column);
    }

    public double getDouble(String column) {
        Object value = get(column);
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        return value == null ? 0.0 : Double.parseDouble(value.toString().trim());
    }

    /**
     * Column stored as epoch millis.
     */
    public Instant getInstant(String column) {
        return isNull(column) ? null : Instant.ofEpochMilli(getLong(column));
    }

    public Set<String> columns() {
        return values.keySet();
    }

    public Map<String, Object> asMap() {
        return values;
    }

    private static String key(String column) {
        return column == null ? "" : column.toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
