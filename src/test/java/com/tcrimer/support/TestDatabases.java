package com.tcrimer.support;

import com.tcrimer.db.BackendKind;
import com.tcrimer.db.DataStore;
import com.tcrimer.db.SchemaMigrator;
import com.tcrimer.db.pool.BackendSelector;
import com.tcrimer.db.pool.ConnectionPool;
import com.tcrimer.db.pool.PoolSettings;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

/**
 * Two SQLite files standing in for the primary and fallback stores, with the real schema.
 */
public final class TestDatabases implements AutoCloseable {
    public final MutableClock clock = new MutableClock(Instant.parse("2024-06-01T00:00:00Z"));
    public final RecordingSink sink = new RecordingSink();
    public final ToggleBackend primary;
    public final ToggleBackend fallback;
    public final BackendSelector selector;
    public final ConnectionPool pool;
    public final DataStore store;

    public TestDatabases(Path dir) {
        this(dir, 3, 0L);
    }

    public TestDatabases(Path dir, int maxAttempts, long backoffMillis) {
        PoolSettings settings = PoolSettings.builder()
                .maxSize(4)
                .acquireTimeout(Duration.ofSeconds(2))
                .reconcileBackoff(Duration.ofSeconds(30))
                .build();
        this.primary = new ToggleBackend(dir.resolve("primary.db"), BackendKind.PRIMARY);
        this.fallback = new ToggleBackend(dir.resolve("fallback.db"), BackendKind.FALLBACK);
        this.selector = new BackendSelector(primary, settings, clock, sink);
        this.pool = new ConnectionPool(primary, fallback, selector, settings, new SchemaMigrator(), clock, sink);
        this.store = new DataStore(pool, maxAttempts, backoffMillis);
    }

    @Override
    public void close() {
        selector.close();
        pool.close();
    }
}
