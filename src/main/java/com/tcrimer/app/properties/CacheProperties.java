package com.tcrimer.app.properties;

import com.tcrimer.cache.CacheSettings;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Getter
@Setter
@ConfigurationProperties(prefix = "cache")
public class CacheProperties {
    private Tier memory = new Tier(1000, 64L * 1024L * 1024L);
    private Tier session = new Tier(10_000, 256L * 1024L * 1024L);
    private long defaultTtlSeconds = 300L;
    private long sweepIntervalSeconds = 0L;

    public CacheSettings toSettings() {
        return CacheSettings.builder()
                .memoryMaxEntries(Math.max(1, memory.getMaxEntries()))
                .memoryMaxBytes(memory.getMaxBytes())
                .sessionMaxEntries(Math.max(1, session.getMaxEntries()))
                .sessionMaxBytes(session.getMaxBytes())
                .defaultTtl(Duration.ofSeconds(Math.max(0L, defaultTtlSeconds)))
                .sweepInterval(Duration.ofSeconds(Math.max(0L, sweepIntervalSeconds)))
                .build();
    }

    @Getter
    @Setter
    public static class Tier {
        private int maxEntries;
        private long maxBytes;

        public Tier() {
        }

        public Tier(int maxEntries, long maxBytes) {
            this.maxEntries = maxEntries;
            this.maxBytes = maxBytes;
        }
    }
}
