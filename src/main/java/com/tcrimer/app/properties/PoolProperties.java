package com.tcrimer.app.properties;

import com.tcrimer.db.pool.PoolSettings;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Getter
@Setter
@ConfigurationProperties(prefix = "pool")
public class PoolProperties {
    private int minSize = 1;
    private int maxSize = 10;
    private long acquireTimeoutMs = 5000L;
    private long staleAfterMs = 30000L;
    private int probeTimeoutSeconds = 2;
    private int primaryFailureThreshold = 3;
    private long reconcileBackoffSeconds = 60L;

    public PoolSettings toSettings() {
        int max = Math.max(1, maxSize);
        return PoolSettings.builder()
                .minSize(Math.max(0, Math.min(max, minSize)))
                .maxSize(max)
                .acquireTimeout(Duration.ofMillis(Math.max(0L, acquireTimeoutMs)))
                .staleAfter(Duration.ofMillis(Math.max(0L, staleAfterMs)))
                .probeTimeoutSeconds(Math.max(1, probeTimeoutSeconds))
                .failureThreshold(Math.max(1, primaryFailureThreshold))
                .reconcileBackoff(Duration.ofSeconds(Math.max(1L, reconcileBackoffSeconds)))
                .build();
    }
}
