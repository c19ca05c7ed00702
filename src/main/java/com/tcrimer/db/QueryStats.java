package com.tcrimer.db;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-statement execution counters. Statements are keyed by their whitespace-collapsed text, so
 * the same prepared statement with different bind values shares one entry.
 */
public final class QueryStats {
    static final int MAX_SQL_LENGTH = 160;

    private final Map<String, Counter> counters = new ConcurrentHashMap<>();

    public void record(String sql, long elapsedNanos, Throwable error) {
        Counter counter = counters.computeIfAbsent(normalize(sql), k -> new Counter());
        counter.add(elapsedNanos / 1_000_000.0, error);
    }

    /**
     * Current counters, slowest average first.
     */
    public List<QueryStat> snapshot() {
        List<QueryStat> out = new ArrayList<>(counters.size());
        for (Map.Entry<String, Counter> entry : counters.entrySet()) {
            out.add(entry.getValue().toStat(entry.getKey()));
        }
        out.sort(Comparator.comparingDouble(QueryStat::avgMillis).reversed().thenComparing(QueryStat::getSql));
        return out;
    }

    public void reset() {
        counters.clear();
    }

    static String normalize(String sql) {
        String collapsed = sql == null ? "" : sql.trim().replaceAll("\\s+", " ");
        if (collapsed.length() > MAX_SQL_LENGTH) {
            return collapsed.substring(0, MAX_SQL_LENGTH) + "...";
        }
        return collapsed;
    }

    private static final class Counter {
        private long executions;
        private long errors;
        private double totalMillis;
        private double minMillis = Double.MAX_VALUE;
        private double maxMillis;
        private String lastError;

        synchronized void add(double millis, Throwable error) {
            executions++;
            totalMillis += millis;
            minMillis = Math.min(minMillis, millis);
            maxMillis = Math.max(maxMillis, millis);
            if (error != null) {
                errors++;
                lastError = String.valueOf(error.getMessage());
            }
        }

        synchronized QueryStat toStat(String sql) {
            return QueryStat.builder()
                    .sql(sql)
                    .executions(executions)
                    .errors(errors)
                    .totalMillis(totalMillis)
                    .minMillis(executions == 0 ? 0.0 : minMillis)
                    .maxMillis(maxMillis)
                    .lastError(lastError)
                    .build();
        }
    }
}
