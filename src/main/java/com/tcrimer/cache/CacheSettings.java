package com.tcrimer.cache;

import com.tcrimer.config.Config;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Tier bounds and TTL defaults. A byte bound of zero or less means the tier is bounded by count only.
 */
@Value
@Builder(toBuilder = true)
public class CacheSettings {
    @Builder.Default
    int memoryMaxEntries = 1000;
    @Builder.Default
    long memoryMaxBytes = 64L * 1024L * 1024L;
    @Builder.Default
    int sessionMaxEntries = 10_000;
    @Builder.Default
    long sessionMaxBytes = 256L * 1024L * 1024L;
    @Builder.Default
    Duration defaultTtl = Duration.ofSeconds(300);
    @Builder.Default
    Duration sweepInterval = Duration.ZERO;

    public static CacheSettings fromConfig(Config config) {
        return CacheSettings.builder()
                .memoryMaxEntries(Math.max(1, config.getInt("cache.memory.max_entries")))
                .memoryMaxBytes(config.getLong("cache.memory.max_bytes"))
                .sessionMaxEntries(Math.max(1, config.getInt("cache.session.max_entries")))
                .sessionMaxBytes(config.getLong("cache.session.max_bytes"))
                .defaultTtl(Duration.ofSeconds(Math.max(0L, config.getLong("cache.default_ttl_seconds"))))
                .sweepInterval(Duration.ofSeconds(Math.max(0L, config.getLong("cache.sweep_interval_seconds"))))
                .build();
    }
}
