package com.tcrimer.db;

import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Timing and error counters for one statement text, as seen by {@link DataStore}.
 */
@Value
@Builder
public class QueryStat {
    String sql;
    long executions;
    long errors;
    double totalMillis;
    double minMillis;
    double maxMillis;
    String lastError;

    public double avgMillis() {
        return executions == 0 ? 0.0 : totalMillis / executions;
    }

    public Map<String, Object> toFields() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("sql", sql);
        out.put("executions", executions);
        out.put("errors", errors);
        out.put("avg_ms", round(avgMillis()));
        out.put("min_ms", round(minMillis));
        out.put("max_ms", round(maxMillis));
        out.put("total_ms", round(totalMillis));
        out.put("last_error", lastError);
        return out;
    }

    private static double round(double millis) {
        return Math.round(millis * 1000.0) / 1000.0;
    }
}
