package com.tcrimer.db.pool;

import com.tcrimer.core.MonitoringEvent;
import com.tcrimer.db.BackendKind;
import com.tcrimer.support.MutableClock;
import com.tcrimer.support.RecordingSink;
import com.tcrimer.support.ToggleBackend;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConnectionPoolTest {
    private static final Instant T0 = Instant.parse("2024-03-01T00:00:00Z");

    @TempDir
    Path tempDir;

    private final List<AutoCloseable> closeables = new ArrayList<>();

    @AfterEach
    void tearDown() throws Exception {
        for (AutoCloseable c : closeables) {
            c.close();
        }
    }

    @Test
    void acquireBeyondMaxShouldTimeOutWithPoolExhausted() throws Exception {
        Fixture f = fixture(PoolSettings.builder().maxSize(2).acquireTimeout(Duration.ofMillis(150)).build());

        Connection first = f.pool.acquire();
        Connection second = f.pool.acquire();
        PoolExhaustedException e = assertThrows(PoolExhaustedException.class, f.pool::acquire);

        assertEquals(BackendKind.PRIMARY, e.backend());
        assertEquals(1, f.pool.stats(BackendKind.PRIMARY).getWaitTimeouts());
        assertEquals(1, f.sink.ofType(MonitoringEvent.POOL_EXHAUSTED).size());
        assertEquals(BackendKind.PRIMARY, f.selector.current());
        first.close();
        second.close();
    }

    @Test
    void blockedAcquireShouldProceedWhenALeaseIsReleased() throws Exception {
        Fixture f = fixture(PoolSettings.builder().maxSize(1).acquireTimeout(Duration.ofSeconds(5)).build());
        Connection held = f.pool.acquire();

        CompletableFuture<Long> waiter = CompletableFuture.supplyAsync(() -> {
            try (Connection c = f.pool.acquire()) {
                return c.unwrap(PooledConnection.class).id();
            } catch (SQLException e) {
                throw new IllegalStateException(e);
            }
        });
        Thread.sleep(100);
        assertFalse(waiter.isDone());
        long heldId = held.unwrap(PooledConnection.class).id();
        held.close();

        assertEquals(heldId, waiter.get(5, TimeUnit.SECONDS));
    }

    @Test
    void brokenConnectionShouldNeverBeHandedOutAgain() throws Exception {
        Fixture f = fixture(PoolSettings.builder().maxSize(2).build());

        Connection lease = f.pool.acquire();
        PooledConnection pooled = lease.unwrap(PooledConnection.class);
        pooled.markBroken();
        lease.close();

        try (Connection next = f.pool.acquire()) {
            PooledConnection fresh = next.unwrap(PooledConnection.class);
            assertNotEquals(pooled.id(), fresh.id());
            assertFalse(fresh.isBroken());
            assertEquals(ConnectionState.IN_USE, fresh.state());
        }
        assertEquals(1, f.pool.stats(BackendKind.PRIMARY).getRetired());
    }

    @Test
    void releasedConnectionShouldBeReused() throws Exception {
        Fixture f = fixture(PoolSettings.builder().maxSize(2).build());

        long firstId;
        try (Connection lease = f.pool.acquire()) {
            firstId = lease.unwrap(PooledConnection.class).id();
        }
        try (Connection lease = f.pool.acquire()) {
            assertEquals(firstId, lease.unwrap(PooledConnection.class).id());
        }
        assertEquals(1, f.pool.stats(BackendKind.PRIMARY).getOpened());
        assertEquals(1, f.pool.stats(BackendKind.PRIMARY).getIdle());
    }

    @Test
    void closedLeaseShouldRejectFurtherUse() throws Exception {
        Fixture f = fixture(PoolSettings.builder().build());

        Connection lease = f.pool.acquire();
        lease.close();
        lease.close();

        assertTrue(lease.isClosed());
        SQLException e = assertThrows(SQLException.class, lease::createStatement);
        assertEquals("08003", e.getSQLState());
        assertEquals(0, f.pool.stats(BackendKind.PRIMARY).getInUse());
    }

    @Test
    void uncommittedWorkShouldBeRolledBackOnRelease() throws Exception {
        Fixture f = fixture(PoolSettings.builder().maxSize(1).build());
        try (Connection c = f.pool.acquire(); Statement st = c.createStatement()) {
            st.execute("CREATE TABLE IF NOT EXISTS t (v INTEGER)");
        }

        try (Connection c = f.pool.acquire(); Statement st = c.createStatement()) {
            c.setAutoCommit(false);
            st.execute("INSERT INTO t (v) VALUES (1)");
        }

        try (Connection c = f.pool.acquire(); Statement st = c.createStatement()) {
            assertTrue(c.getAutoCommit());
            try (ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM t")) {
                rs.next();
                assertEquals(0, rs.getInt(1));
            }
        }
    }

    @Test
    void threeConsecutivePrimaryFailuresShouldFailOverToFallback() throws Exception {
        Fixture f = fixture(PoolSettings.builder().failureThreshold(3).build());
        f.primary.setDown(true);

        try (Connection lease = f.pool.acquire()) {
            assertEquals(BackendKind.FALLBACK, lease.unwrap(PooledConnection.class).backendKind());
        }

        assertEquals(3, f.primary.connectAttempts());
        assertEquals(BackendKind.FALLBACK, f.selector.current());
        assertEquals(BackendKind.FALLBACK, f.pool.authoritative());
        assertEquals(1, f.sink.ofType(MonitoringEvent.FAILOVER).size());
        assertTrue(f.selector.lastFailoverReason().contains("consecutive_primary_failures=3"));
    }

    @Test
    void interruptedAcquireShouldNotCountAsPrimaryFailure() {
        Fixture f = fixture(PoolSettings.builder().failureThreshold(3).build());

        Thread.currentThread().interrupt();
        AcquireInterruptedException e;
        try {
            e = assertThrows(AcquireInterruptedException.class, f.pool::acquire);
        } finally {
            assertTrue(Thread.interrupted());
        }

        assertEquals(BackendKind.PRIMARY, e.backend());
        assertEquals(0, f.pool.consecutivePrimaryFailures());
        assertEquals(BackendKind.PRIMARY, f.selector.current());
        assertTrue(f.sink.ofType(MonitoringEvent.FAILOVER).isEmpty());
        assertEquals(0, f.pool.stats(BackendKind.PRIMARY).getInUse());
    }

    @Test
    void staleConnectionFailingProbeShouldBeReplacedTransparently() throws Exception {
        PoolSettings settings = PoolSettings.builder().maxSize(2).staleAfter(Duration.ofSeconds(30)).build();
        Fixture f = fixture(settings);

        PooledConnection first;
        try (Connection lease = f.pool.acquire()) {
            first = lease.unwrap(PooledConnection.class);
        }
        first.handle().close();
        f.clock.advance(settings.getStaleAfter().plusSeconds(1));

        try (Connection lease = f.pool.acquire()) {
            PooledConnection replacement = lease.unwrap(PooledConnection.class);
            assertNotEquals(first.id(), replacement.id());
            assertFalse(replacement.isBroken());
        }
        PoolStats stats = f.pool.stats(BackendKind.PRIMARY);
        assertEquals(1, stats.getRetired());
        assertEquals(2, stats.getOpened());
        assertEquals(0, f.pool.consecutivePrimaryFailures());
        assertEquals(BackendKind.PRIMARY, f.selector.current());
    }

    @Test
    void staleConnectionPassingProbeShouldBeReused() throws Exception {
        PoolSettings settings = PoolSettings.builder().staleAfter(Duration.ofSeconds(30)).build();
        Fixture f = fixture(settings);

        long firstId;
        try (Connection lease = f.pool.acquire()) {
            firstId = lease.unwrap(PooledConnection.class).id();
        }
        f.clock.advance(Duration.ofMinutes(5));

        try (Connection lease = f.pool.acquire()) {
            PooledConnection pooled = lease.unwrap(PooledConnection.class);
            assertEquals(firstId, pooled.id());
            assertEquals(f.clock.instant(), pooled.lastHealthCheckAt());
        }
        assertEquals(1, f.pool.stats(BackendKind.PRIMARY).getOpened());
    }

    @Test
    void successfulReconcileProbeShouldRevertToPrimaryAfterBackoff() throws Exception {
        Fixture f = fixture(PoolSettings.builder().reconcileBackoff(Duration.ofSeconds(60)).build());
        f.primary.setDown(true);
        f.pool.acquire().close();
        assertEquals(BackendKind.FALLBACK, f.selector.current());

        f.primary.setDown(false);
        assertFalse(f.selector.tryReconcile());

        f.clock.advance(Duration.ofSeconds(61));
        assertTrue(f.selector.tryReconcile());

        assertEquals(BackendKind.PRIMARY, f.selector.current());
        assertEquals(0, f.pool.consecutivePrimaryFailures());
        assertEquals(1, f.sink.ofType(MonitoringEvent.FAILBACK).size());
        try (Connection lease = f.pool.acquire()) {
            assertEquals(BackendKind.PRIMARY, lease.unwrap(PooledConnection.class).backendKind());
        }
    }

    @Test
    void failedReconcileProbeShouldStayOnFallbackAndRestartBackoff() throws Exception {
        Fixture f = fixture(PoolSettings.builder().reconcileBackoff(Duration.ofSeconds(10)).build());
        f.selector.failover("test");

        f.clock.advance(Duration.ofSeconds(11));
        f.primary.setDown(true);
        assertFalse(f.selector.tryReconcile());

        f.primary.setDown(false);
        f.clock.advance(Duration.ofSeconds(5));
        assertFalse(f.selector.tryReconcile());
        f.clock.advance(Duration.ofSeconds(6));
        assertTrue(f.selector.tryReconcile());
    }

    @Test
    void initializerShouldRunOncePerBackend() throws Exception {
        AtomicInteger primaryInits = new AtomicInteger();
        AtomicInteger fallbackInits = new AtomicInteger();
        BackendInitializer counting = (kind, conn) -> {
            if (kind == BackendKind.PRIMARY) {
                primaryInits.incrementAndGet();
            } else {
                fallbackInits.incrementAndGet();
            }
        };
        Fixture f = fixture(PoolSettings.builder().maxSize(3).build(), counting);

        Connection a = f.pool.acquire();
        Connection b = f.pool.acquire();
        a.close();
        b.close();
        f.pool.acquire(BackendKind.FALLBACK).close();

        assertEquals(1, primaryInits.get());
        assertEquals(1, fallbackInits.get());
    }

    @Test
    void directFallbackAcquireShouldNotCountTowardFailover() throws Exception {
        Fixture f = fixture(PoolSettings.builder().build());
        f.primary.setDown(true);

        assertThrows(SQLException.class, () -> f.pool.acquire(BackendKind.PRIMARY));

        assertEquals(0, f.pool.consecutivePrimaryFailures());
        assertEquals(BackendKind.PRIMARY, f.selector.current());
    }

    @Test
    void startupProbeShouldSelectFallbackWhenPrimaryIsDown() {
        ToggleBackend primary = new ToggleBackend(tempDir.resolve("p.db"), BackendKind.PRIMARY);
        primary.setDown(true);
        RecordingSink sink = new RecordingSink();
        BackendSelector selector = new BackendSelector(primary, PoolSettings.builder().build(), new MutableClock(T0), sink);
        AtomicInteger failovers = new AtomicInteger();
        selector.addListener(new BackendTransitionListener() {
            @Override
            public void onFailover(String reason) {
                failovers.incrementAndGet();
            }
        });

        assertEquals(BackendKind.FALLBACK, selector.initialize());
        assertEquals(1, failovers.get());
        assertEquals("startup probe failed", selector.lastFailoverReason());
        assertFalse(selector.failover("again"));
        assertTrue(selector.lastPrimaryOkAt().isEmpty());
    }

    @Test
    void publishOccupancyShouldReportBothBackends() throws Exception {
        Fixture f = fixture(PoolSettings.builder().maxSize(4).build());
        Connection lease = f.pool.acquire();

        f.pool.publishOccupancy();

        List<MonitoringEvent> events = f.sink.ofType(MonitoringEvent.POOL_OCCUPANCY);
        assertEquals(2, events.size());
        assertEquals(1, events.get(0).fields().get("in_use"));
        assertEquals(true, events.get(0).fields().get("authoritative"));
        lease.close();
    }

    private Fixture fixture(PoolSettings settings) {
        return fixture(settings, BackendInitializer.none());
    }

    private Fixture fixture(PoolSettings settings, BackendInitializer initializer) {
        Fixture f = new Fixture();
        f.clock = new MutableClock(T0);
        f.sink = new RecordingSink();
        f.primary = new ToggleBackend(tempDir.resolve("primary.db"), BackendKind.PRIMARY);
        f.fallback = new ToggleBackend(tempDir.resolve("fallback.db"), BackendKind.FALLBACK);
        f.selector = new BackendSelector(f.primary, settings, f.clock, f.sink);
        f.pool = new ConnectionPool(f.primary, f.fallback, f.selector, settings, initializer, f.clock, f.sink);
        closeables.add(f.pool);
        closeables.add(f.selector);
        return f;
    }

    private static final class Fixture {
        MutableClock clock;
        RecordingSink sink;
        ToggleBackend primary;
        ToggleBackend fallback;
        BackendSelector selector;
        ConnectionPool pool;
    }
}
