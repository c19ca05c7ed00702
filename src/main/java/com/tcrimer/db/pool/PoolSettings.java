package com.tcrimer.db.pool;

import com.tcrimer.config.Config;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

@Value
@Builder(toBuilder = true)
public class PoolSettings {
    @Builder.Default
    int minSize = 1;
    @Builder.Default
    int maxSize = 10;
    @Builder.Default
    Duration acquireTimeout = Duration.ofMillis(5000);
    /**
     * Idle time after which a connection is probed before reuse.
     */
    @Builder.Default
    Duration staleAfter = Duration.ofSeconds(30);
    @Builder.Default
    int probeTimeoutSeconds = 2;
    /**
     * Consecutive primary acquire/probe failures that trigger failover.
     */
    @Builder.Default
    int failureThreshold = 3;
    @Builder.Default
    Duration reconcileBackoff = Duration.ofSeconds(60);

    public static PoolSettings fromConfig(Config config) {
        int max = Math.max(1, config.getInt("pool.max_size"));
        return PoolSettings.builder()
                .minSize(Math.max(0, Math.min(max, config.getInt("pool.min_size"))))
                .maxSize(max)
                .acquireTimeout(Duration.ofMillis(Math.max(0L, config.getLong("pool.acquire_timeout_ms"))))
                .staleAfter(Duration.ofMillis(Math.max(0L, config.getLong("pool.stale_after_ms"))))
                .probeTimeoutSeconds(Math.max(1, config.getInt("pool.probe_timeout_seconds")))
                .failureThreshold(Math.max(1, config.getInt("failover.primary_failure_threshold")))
                .reconcileBackoff(Duration.ofSeconds(Math.max(1L, config.getLong("failover.reconcile_backoff_seconds"))))
                .build();
    }
}
