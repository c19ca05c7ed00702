package com.tcrimer.config;

import com.tcrimer.cache.CacheSettings;
import com.tcrimer.db.pool.PoolSettings;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void localFileShouldOverrideClasspathAndDefaults() throws IOException {
        Files.writeString(tempDir.resolve("config.properties"), "pool.max_size=3\nbacktest.workers= \n");

        Config config = Config.load(tempDir);

        assertEquals(3, config.getInt("pool.max_size"));
        assertEquals("override", config.sourceOf("pool.max_size"));
        assertEquals(4, config.getInt("backtest.workers"));
        assertEquals("resource", config.sourceOf("backtest.workers"));
        assertEquals(250, config.getInt("indicator.lookback_bars"));
        assertEquals("default", config.sourceOf("indicator.lookback_bars"));
        assertEquals("default", config.sourceOf(" "));
    }

    @Test
    void malformedNumbersShouldFallBackToDefaults() {
        Config config = Config.fromConfigurationProperties(tempDir, Map.of("pool", Map.of("max_size", "many")));

        assertEquals(10, config.getInt("pool.max_size"));
        assertEquals(7, config.getInt("unknown.key", 7));
    }

    @Test
    void nestedPropertiesShouldFlattenToDottedKeys() {
        Config config = Config.fromConfigurationProperties(tempDir, Map.of(
                "db", Map.of("sql_log", Map.of("enabled", "yes")),
                "symbols", List.of("AAPL", "MSFT")));

        assertTrue(config.getBoolean("db.sql_log.enabled"));
        assertEquals("AAPL,MSFT", config.getString("symbols"));
        assertFalse(config.getBoolean("missing.flag"));
    }

    @Test
    void settingsShouldBeReadFromConfig() {
        Config config = Config.fromConfigurationProperties(tempDir, Map.of(
                "pool", Map.of("max_size", "4", "min_size", "9"),
                "failover", Map.of("reconcile_backoff_seconds", "15"),
                "cache", Map.of("default_ttl_seconds", "30")));

        PoolSettings pool = PoolSettings.fromConfig(config);
        CacheSettings cache = CacheSettings.fromConfig(config);

        assertEquals(4, pool.getMaxSize());
        assertEquals(4, pool.getMinSize());
        assertEquals(Duration.ofSeconds(15), pool.getReconcileBackoff());
        assertEquals(Duration.ofSeconds(30), cache.getDefaultTtl());
        assertEquals(1000, cache.getMemoryMaxEntries());
    }

    @Test
    void relativePathsShouldResolveAgainstWorkingDir() {
        Config config = Config.fromConfigurationProperties(tempDir, Map.of());

        assertEquals(tempDir.resolve("outputs/tcrimer.db").normalize(), config.getPath("db.fallback.path"));
    }
}
