package com.tcrimer.config;

import java.io.IOException;
import java.io.InputStream;
import java.lang.reflect.Array;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * Layered key/value configuration.
 * <p>
 * Resolution order: {@code ./config.properties} in the working directory, then the classpath
 * {@code config.properties}, then the built-in defaults. Every key has a default, so a missing
 * file never blocks startup.
 */
public final class Config {

    private static final Map<String, String> DEFAULTS = buildDefaults();

    private final Properties props = new Properties();
    private final Properties resourceProps = new Properties();
    private final Properties overrideProps = new Properties();
    private final Path workingDir;

    private Config(Path workingDir) {
        this.workingDir = workingDir;
    }

    public static Config load(Path workingDir) {
        Config config = new Config(workingDir);

        try (InputStream in = Config.class.getClassLoader().getResourceAsStream("config.properties")) {
            if (in != null) {
                config.resourceProps.load(in);
                config.props.putAll(config.resourceProps);
            }
        } catch (IOException e) {
            System.err.println("WARN: failed to read classpath config.properties: " + e.getMessage());
        }

        Path local = workingDir.resolve("config.properties");
        if (Files.exists(local)) {
            try (InputStream in = Files.newInputStream(local)) {
                config.overrideProps.load(in);
                config.props.putAll(config.overrideProps);
            } catch (IOException e) {
                System.err.println("WARN: failed to read config.properties: " + e.getMessage());
            }
        }

        return config;
    }

    /**
     * Build Config from Spring-bound configuration properties or any nested map.
     */
    public static Config fromConfigurationProperties(Path workingDir, Map<String, ?> rawProperties) {
        Config config = new Config(workingDir);
        flattenInto(config, "", rawProperties);
        return config;
    }

    public Path workingDir() {
        return workingDir;
    }

    public String getString(String key) {
        String raw = props.getProperty(key);
        if (raw != null) {
            String trimmed = raw.trim();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return DEFAULTS.getOrDefault(key, "");
    }

    public String getString(String key, String fallback) {
        String value = getString(key);
        if (value.isEmpty()) {
            return fallback;
        }
        return value;
    }

    public boolean getBoolean(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return false;
        }
        return "true".equalsIgnoreCase(value)
                || "1".equals(value)
                || "yes".equalsIgnoreCase(value)
                || "y".equalsIgnoreCase(value);
    }

    public boolean getBoolean(String key, boolean fallback) {
        if (getString(key).isEmpty()) {
            return fallback;
        }
        return getBoolean(key);
    }

    public int getInt(String key) {
        return getInt(key, parseInt(DEFAULTS.get(key), 0));
    }

    public int getInt(String key, int fallback) {
        return parseInt(getString(key), fallback);
    }

    public long getLong(String key) {
        return getLong(key, parseLong(DEFAULTS.get(key), 0L));
    }

    public long getLong(String key, long fallback) {
        return parseLong(getString(key), fallback);
    }

    public Path getPath(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return workingDir;
        }
        return workingDir.resolve(value).normalize();
    }

    /**
     * Where a key's effective value came from: {@code override}, {@code resource} or {@code default}.
     */
    public String sourceOf(String key) {
        if (key == null || key.trim().isEmpty()) {
            return "default";
        }
        if (!nonBlank(overrideProps.getProperty(key)).isEmpty()) {
            return "override";
        }
        if (!nonBlank(resourceProps.getProperty(key)).isEmpty()) {
            return "resource";
        }
        return "default";
    }

    private String nonBlank(String raw) {
        if (raw == null) {
            return "";
        }
        return raw.trim();
    }

    private static void flattenInto(Config config, String prefix, Object value) {
        if (config == null || value == null) {
            return;
        }
        if (value instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                String key = entry.getKey() == null ? "" : entry.getKey().toString().trim();
                if (key.isEmpty()) {
                    continue;
                }
                String fullKey = prefix.isEmpty() ? key : prefix + "." + key;
                flattenInto(config, fullKey, entry.getValue());
            }
            return;
        }
        if (value instanceof List<?> list) {
            List<String> parts = new ArrayList<>();
            for (Object item : list) {
                parts.add(stringify(item));
            }
            putBoundValue(config, prefix, String.join(",", parts));
            return;
        }
        if (value.getClass().isArray()) {
            int len = Array.getLength(value);
            List<String> parts = new ArrayList<>(len);
            for (int i = 0; i < len; i++) {
                parts.add(stringify(Array.get(value, i)));
            }
            putBoundValue(config, prefix, String.join(",", parts));
            return;
        }
        putBoundValue(config, prefix, stringify(value));
    }

    private static void putBoundValue(Config config, String key, String value) {
        if (key == null || key.trim().isEmpty()) {
            return;
        }
        String normalizedKey = key.trim();
        String normalizedValue = value == null ? "" : value;
        config.overrideProps.setProperty(normalizedKey, normalizedValue);
        config.props.setProperty(normalizedKey, normalizedValue);
    }

    private static String stringify(Object value) {
        return value == null ? "" : String.valueOf(value);
    }

    private static int parseInt(String value, int fallback) {
        try {
            return Integer.parseInt(value.trim());
        } catch (Exception ignored) {
            return fallback;
        }
    }

    private static long parseLong(String value, long fallback) {
        try {
            return Long.parseLong(value.trim());
        } catch (Exception ignored) {
            return fallback;
        }
    }

    private static Map<String, String> buildDefaults() {
        Map<String, String> defaults = new LinkedHashMap<>();

        defaults.put("outputs.dir", "outputs");

        defaults.put("db.primary.url", "jdbc:postgresql://localhost:5432/tcrimer");
        defaults.put("db.primary.user", "tcrimer");
        defaults.put("db.primary.pass", "tcrimer");
        defaults.put("db.primary.schema", "tcrimer");
        defaults.put("db.fallback.path", "outputs/tcrimer.db");
        defaults.put("db.sql_log.enabled", "false");

        defaults.put("pool.min_size", "1");
        defaults.put("pool.max_size", "10");
        defaults.put("pool.acquire_timeout_ms", "5000");
        defaults.put("pool.stale_after_ms", "30000");
        defaults.put("pool.probe_timeout_seconds", "2");

        defaults.put("failover.primary_failure_threshold", "3");
        defaults.put("failover.reconcile_backoff_seconds", "60");

        defaults.put("datastore.max_attempts", "3");
        defaults.put("datastore.backoff_ms", "100");
        defaults.put("datastore.slow_query_ms", "1000");
        defaults.put("maintenance.min_interval_hours", "24");

        defaults.put("cache.memory.max_entries", "1000");
        defaults.put("cache.memory.max_bytes", "67108864");
        defaults.put("cache.session.max_entries", "10000");
        defaults.put("cache.session.max_bytes", "268435456");
        defaults.put("cache.default_ttl_seconds", "300");
        defaults.put("cache.sweep_interval_seconds", "0");

        defaults.put("upstream.base_url", "https://stooq.com/q/d/l/?s=%s&i=d");
        defaults.put("upstream.fetch_timeout_seconds", "15");
        defaults.put("upstream.retry_count", "2");
        defaults.put("upstream.retry_sleep_ms", "700");
        defaults.put("upstream.circuit_breaker.timeout_streak", "5");
        defaults.put("upstream.circuit_breaker.cooldown_sec", "60");

        defaults.put("backtest.workers", "4");
        defaults.put("backtest.run_timeout_seconds", "120");
        defaults.put("backtest.timeframe", "1d");
        defaults.put("indicator.lookback_bars", "250");

        defaults.put("events.queue_capacity", "1024");
        return Collections.unmodifiableMap(defaults);
    }
}
