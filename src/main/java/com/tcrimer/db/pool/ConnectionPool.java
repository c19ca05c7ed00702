package com.tcrimer.db.pool;

import com.tcrimer.core.MonitoringEvent;
import com.tcrimer.core.MonitoringSink;
import com.tcrimer.db.Backend;
import com.tcrimer.db.BackendKind;
import com.tcrimer.db.SqlErrors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded connection pools for the primary and fallback backends.
 * <p>
 * {@link #acquire()} leases from whichever backend the {@link BackendSelector} marks authoritative.
 * The returned {@link Connection} is a lease handle: closing it returns the physical connection to
 * the pool, and {@code unwrap(PooledConnection.class)} exposes the pooled state so a caller can
 * {@link PooledConnection#markBroken() mark it broken}. Consecutive primary failures up to the
 * configured threshold trigger failover, and the acquire that crossed it is served by the fallback.
 */
public final class ConnectionPool implements AutoCloseable, BackendTransitionListener {
    private static final Logger log = LogManager.getLogger(ConnectionPool.class);

    private final PoolSettings settings;
    private final BackendSelector selector;
    private final BackendInitializer initializer;
    private final Clock clock;
    private final MonitoringSink sink;
    private final Map<BackendKind, BackendPool> pools = new EnumMap<>(BackendKind.class);
    private final AtomicInteger primaryFailures = new AtomicInteger();
    private final AtomicLong ids = new AtomicLong();
    private final ExecutorService retirer;
    private volatile boolean closed;

    public ConnectionPool(Backend primary,
                          Backend fallback,
                          BackendSelector selector,
                          PoolSettings settings,
                          BackendInitializer initializer,
                          Clock clock,
                          MonitoringSink sink) {
        this.settings = settings;
        this.selector = selector;
        this.initializer = initializer == null ? BackendInitializer.none() : initializer;
        this.clock = clock;
        this.sink = sink == null ? MonitoringSink.noop() : sink;
        this.pools.put(BackendKind.PRIMARY, new BackendPool(primary, settings.getMaxSize()));
        this.pools.put(BackendKind.FALLBACK, new BackendPool(fallback, settings.getMaxSize()));
        this.retirer = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "tcrimer-pool-retire");
            t.setDaemon(true);
            return t;
        });
        selector.addListener(this);
    }

    /**
     * Leases a connection from the authoritative backend.
     *
     * @throws PoolExhaustedException when nothing frees up within the acquire timeout
     * @throws AcquireInterruptedException when the calling thread is interrupted
     * @throws SQLException when the fallback cannot be opened either
     */
    public Connection acquire() throws SQLException {
        ensureOpen();
        while (selector.current() == BackendKind.PRIMARY) {
            try {
                Connection lease = lease(BackendKind.PRIMARY);
                primaryFailures.set(0);
                selector.recordPrimarySuccess();
                return lease;
            } catch (PoolExhaustedException | AcquireInterruptedException e) {
                throw e;
            } catch (SQLException e) {
                int failures = primaryFailures.incrementAndGet();
                log.warn("primary acquire failed consecutive_failures={} threshold={} err={}",
                        failures, settings.getFailureThreshold(), e.getMessage());
                if (failures >= settings.getFailureThreshold()) {
                    selector.failover("consecutive_primary_failures=" + failures);
                    break;
                }
            }
        }
        return lease(BackendKind.FALLBACK);
    }

    /**
     * Leases from one backend regardless of which is authoritative. Failures here do not count
     * toward failover.
     */
    public Connection acquire(BackendKind kind) throws SQLException {
        ensureOpen();
        return lease(kind);
    }

    /**
     * Opens {@code minSize} connections on the authoritative backend and parks them idle.
     */
    public int warmUp() throws SQLException {
        List<Connection> leases = new ArrayList<>();
        try {
            for (int i = 0; i < settings.getMinSize(); i++) {
                leases.add(acquire());
            }
        } finally {
            for (Connection lease : leases) {
                lease.close();
            }
        }
        return leases.size();
    }

    public BackendKind authoritative() {
        return selector.current();
    }

    public BackendSelector selector() {
        return selector;
    }

    public int consecutivePrimaryFailures() {
        return primaryFailures.get();
    }

    public PoolStats stats(BackendKind kind) {
        BackendPool pool = pools.get(kind);
        return PoolStats.builder()
                .backend(kind)
                .idle(pool.idle.size())
                .inUse(settings.getMaxSize() - pool.permits.availablePermits())
                .maxSize(settings.getMaxSize())
                .opened(pool.opened.get())
                .retired(pool.retired.get())
                .waitTimeouts(pool.waitTimeouts.get())
                .build();
    }

    public void publishOccupancy() {
        for (BackendKind kind : BackendKind.values()) {
            Map<String, Object> fields = stats(kind).toFields();
            fields.put("authoritative", selector.current() == kind);
            sink.publish(MonitoringEvent.of(MonitoringEvent.POOL_OCCUPANCY, fields));
        }
    }

    @Override
    public void onFailover(String reason) {
        int drained = drainIdle(pools.get(BackendKind.PRIMARY));
        log.info("failover drained idle primary connections count={}", drained);
    }

    @Override
    public void onFailback() {
        primaryFailures.set(0);
        // a primary that was down may have lost its schema
        pools.get(BackendKind.PRIMARY).initialized = false;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        for (BackendPool pool : pools.values()) {
            drainIdle(pool);
        }
        retirer.shutdown();
        try {
            if (!retirer.awaitTermination(5, TimeUnit.SECONDS)) {
                retirer.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            retirer.shutdownNow();
        }
    }

    private Connection lease(BackendKind kind) throws SQLException {
        BackendPool pool = pools.get(kind);
        long timeoutMs = settings.getAcquireTimeout().toMillis();
        long started = System.nanoTime();
        boolean permitted;
        try {
            permitted = pool.permits.tryAcquire(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AcquireInterruptedException(kind, e);
        }
        if (!permitted) {
            long waited = (System.nanoTime() - started) / 1_000_000L;
            pool.waitTimeouts.incrementAndGet();
            Map<String, Object> fields = stats(kind).toFields();
            fields.put("waited_ms", waited);
            sink.publish(MonitoringEvent.of(MonitoringEvent.POOL_EXHAUSTED, fields));
            throw new PoolExhaustedException(kind, settings.getMaxSize(), waited);
        }
        try {
            PooledConnection pooled = takeHealthy(kind, pool);
            pooled.markInUse();
            return leaseHandle(pool, pooled);
        } catch (SQLException | RuntimeException e) {
            pool.permits.release();
            throw e;
        }
    }

    private PooledConnection takeHealthy(BackendKind kind, BackendPool pool) throws SQLException {
        PooledConnection candidate;
        while ((candidate = pool.idle.pollFirst()) != null) {
            if (candidate.isBroken()) {
                retire(pool, candidate);
                continue;
            }
            Instant now = clock.instant();
            if (!isStale(candidate, now)) {
                return candidate;
            }
            if (probe(candidate)) {
                candidate.markHealthy(now);
                return candidate;
            }
            log.info("stale {} connection failed probe, retiring id={}", kind, candidate.id());
            if (kind == BackendKind.PRIMARY) {
                primaryFailures.incrementAndGet();
            }
            retire(pool, candidate);
        }
        return open(kind, pool);
    }

    private PooledConnection open(BackendKind kind, BackendPool pool) throws SQLException {
        Connection raw = pool.backend.connect();
        try {
            initializeOnce(kind, pool, raw);
        } catch (SQLException | RuntimeException e) {
            closePhysical(kind, raw);
            throw e;
        }
        pool.opened.incrementAndGet();
        PooledConnection pooled = new PooledConnection(ids.incrementAndGet(), kind, raw, clock.instant());
        log.debug("opened {} connection id={}", kind, pooled.id());
        return pooled;
    }

    private void initializeOnce(BackendKind kind, BackendPool pool, Connection raw) throws SQLException {
        if (pool.initialized) {
            return;
        }
        synchronized (pool) {
            if (pool.initialized) {
                return;
            }
            boolean autoCommit = raw.getAutoCommit();
            initializer.initialize(kind, raw);
            if (raw.getAutoCommit() != autoCommit) {
                raw.setAutoCommit(autoCommit);
            }
            pool.initialized = true;
            log.info("backend initialized kind={} target={}", kind, pool.backend.describe());
        }
    }

    private boolean isStale(PooledConnection pooled, Instant now) {
        long staleMs = settings.getStaleAfter().toMillis();
        Instant lastUsed = pooled.lastReturnedAt();
        Instant lastChecked = pooled.lastHealthCheckAt();
        Instant reference = lastChecked.isAfter(lastUsed) ? lastChecked : lastUsed;
        return now.toEpochMilli() - reference.toEpochMilli() >= staleMs;
    }

    private boolean probe(PooledConnection pooled) {
        try {
            return !pooled.handle().isClosed() && pooled.handle().isValid(settings.getProbeTimeoutSeconds());
        } catch (SQLException e) {
            log.debug("probe error id={} err={}", pooled.id(), e.getMessage());
            return false;
        }
    }

    private void release(BackendPool pool, PooledConnection pooled) {
        try {
            if (!pooled.isBroken()) {
                Connection handle = pooled.handle();
                if (handle.isClosed()) {
                    pooled.markBroken();
                } else if (!handle.getAutoCommit()) {
                    handle.rollback();
                    handle.setAutoCommit(true);
                }
            }
        } catch (SQLException e) {
            log.debug("reset on release failed id={} err={}", pooled.id(), e.getMessage());
            pooled.markBroken();
        }
        try {
            if (pooled.isBroken() || closed) {
                retire(pool, pooled);
            } else {
                pooled.markIdle(clock.instant());
                pool.idle.addFirst(pooled);
            }
        } finally {
            pool.permits.release();
        }
    }

    private void retire(BackendPool pool, PooledConnection pooled) {
        pooled.markBroken();
        pool.retired.incrementAndGet();
        try {
            retirer.execute(() -> closePhysical(pooled.backendKind(), pooled.handle()));
        } catch (RejectedExecutionException e) {
            closePhysical(pooled.backendKind(), pooled.handle());
        }
    }

    private int drainIdle(BackendPool pool) {
        int drained = 0;
        PooledConnection pooled;
        while ((pool != null) && (pooled = pool.idle.pollFirst()) != null) {
            retire(pool, pooled);
            drained++;
        }
        return drained;
    }

    private void closePhysical(BackendKind kind, Connection raw) {
        try {
            raw.close();
        } catch (SQLException e) {
            log.debug("close {} connection failed: {}", kind, e.getMessage());
        }
    }

    private void ensureOpen() throws SQLException {
        if (closed) {
            throw new SQLException("connection pool is closed", "08003");
        }
    }

    private Connection leaseHandle(BackendPool pool, PooledConnection pooled) {
        AtomicBoolean released = new AtomicBoolean(false);
        return (Connection) Proxy.newProxyInstance(
                Connection.class.getClassLoader(),
                new Class[]{Connection.class},
                (proxy, method, args) -> {
                    switch (method.getName()) {
                        case "close":
                            if (released.compareAndSet(false, true)) {
                                release(pool, pooled);
                            }
                            return null;
                        case "isClosed":
                            if (released.get()) {
                                return true;
                            }
                            break;
                        case "unwrap":
                            if (args[0] == PooledConnection.class) {
                                return pooled;
                            }
                            break;
                        case "isWrapperFor":
                            if (args[0] == PooledConnection.class) {
                                return true;
                            }
                            break;
                        case "equals":
                            return proxy == args[0];
                        case "hashCode":
                            return System.identityHashCode(proxy);
                        case "toString":
                            return "Lease{" + pooled + "}";
                        default:
                            break;
                    }
                    if (released.get()) {
                        throw new SQLException("connection lease already closed", "08003");
                    }
                    try {
                        return method.invoke(pooled.handle(), args);
                    } catch (InvocationTargetException e) {
                        Throwable target = e.getTargetException();
                        if (target instanceof SQLException sql && SqlErrors.isConnectionFailure(sql)) {
                            pooled.markBroken();
                        }
                        throw target;
                    }
                }
        );
    }

    private static final class BackendPool {
        private final Backend backend;
        private final Semaphore permits;
        private final Deque<PooledConnection> idle = new ConcurrentLinkedDeque<>();
        private final AtomicLong opened = new AtomicLong();
        private final AtomicLong retired = new AtomicLong();
        private final AtomicLong waitTimeouts = new AtomicLong();
        private volatile boolean initialized;

        private BackendPool(Backend backend, int maxSize) {
            this.backend = backend;
            this.permits = new Semaphore(Math.max(1, maxSize), true);
        }
    }
}
