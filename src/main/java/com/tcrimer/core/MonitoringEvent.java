package com.tcrimer.core;

import org.json.JSONObject;

import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One structured event for the monitoring collaborator.
 */
public record MonitoringEvent(String type, Instant at, Map<String, Object> fields) {
    public static final String CACHE_STATS = "CACHE_STATS";
    public static final String CACHE_DEGRADED = "CACHE_DEGRADED";
    public static final String POOL_OCCUPANCY = "POOL_OCCUPANCY";
    public static final String POOL_EXHAUSTED = "POOL_EXHAUSTED";
    public static final String FAILOVER = "FAILOVER";
    public static final String FAILBACK = "FAILBACK";
    public static final String BACKTEST_OUTCOME = "BACKTEST_OUTCOME";
    public static final String QUERY_STATS = "QUERY_STATS";
    public static final String MAINTENANCE = "MAINTENANCE";

    public MonitoringEvent {
        type = type == null || type.isBlank() ? "UNKNOWN" : type.trim();
        at = at == null ? Instant.now() : at;
        fields = fields == null ? Map.of() : new LinkedHashMap<>(fields);
    }

    public static MonitoringEvent of(String type, Map<String, Object> fields) {
        return new MonitoringEvent(type, Instant.now(), fields);
    }

    public String toJsonLine() {
        JSONObject json = new JSONObject();
        json.put("type", type);
        json.put("at", DateTimeFormatter.ISO_INSTANT.format(at));
        for (Map.Entry<String, Object> entry : fields.entrySet()) {
            json.put(entry.getKey(), entry.getValue() == null ? JSONObject.NULL : entry.getValue());
        }
        return json.toString();
    }
}
