package com.tcrimer.cache;

import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

@Value
@Builder
public class CacheStats {
    long hits;
    long misses;
    long evictions;
    long expirations;
    long degraded;
    int memoryEntries;
    long memoryBytes;
    int sessionEntries;
    long sessionBytes;

    public double hitRate() {
        long total = hits + misses;
        return total == 0L ? 0.0 : (double) hits / total;
    }

    public Map<String, Object> toFields() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("hits", hits);
        out.put("misses", misses);
        out.put("evictions", evictions);
        out.put("expirations", expirations);
        out.put("degraded", degraded);
        out.put("memory_entries", memoryEntries);
        out.put("memory_bytes", memoryBytes);
        out.put("session_entries", sessionEntries);
        out.put("session_bytes", sessionBytes);
        out.put("hit_rate", Math.round(hitRate() * 10000.0) / 10000.0);
        return out;
    }
}
