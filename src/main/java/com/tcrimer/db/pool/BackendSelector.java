package com.tcrimer.db.pool;

import com.tcrimer.core.MonitoringEvent;
import com.tcrimer.core.MonitoringSink;
import com.tcrimer.db.Backend;
import com.tcrimer.db.BackendKind;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Which backend is authoritative right now.
 * <p>
 * Reads are lock-free. Every transition (failover, failback, startup probe) goes through one
 * write lock, so at most one is in flight. Reconciliation probes the primary no more than once
 * per backoff interval.
 */
public final class BackendSelector implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(BackendSelector.class);

    private final Backend primary;
    private final Duration reconcileBackoff;
    private final int probeTimeoutSeconds;
    private final Clock clock;
    private final MonitoringSink sink;
    private final ReentrantLock writeLock = new ReentrantLock();
    private final List<BackendTransitionListener> listeners = new CopyOnWriteArrayList<>();

    private volatile BackendKind current = BackendKind.PRIMARY;
    private volatile Instant lastPrimaryOkAt;
    private volatile Instant lastReconcileAttemptAt;
    private volatile String lastFailoverReason = "";
    private ScheduledExecutorService reconciler;

    public BackendSelector(Backend primary, PoolSettings settings, Clock clock, MonitoringSink sink) {
        this.primary = primary;
        this.reconcileBackoff = settings.getReconcileBackoff();
        this.probeTimeoutSeconds = settings.getProbeTimeoutSeconds();
        this.clock = clock;
        this.sink = sink == null ? MonitoringSink.noop() : sink;
    }

    /**
     * Startup probe: PRIMARY when it answers, FALLBACK otherwise.
     */
    public BackendKind initialize() {
        if (probePrimary()) {
            log.info("backend selector init: primary reachable ({})", primary.describe());
            return current;
        }
        failover("startup probe failed");
        return current;
    }

    public BackendKind current() {
        return current;
    }

    public boolean isPrimaryAuthoritative() {
        return current == BackendKind.PRIMARY;
    }

    public Optional<Instant> lastPrimaryOkAt() {
        return Optional.ofNullable(lastPrimaryOkAt);
    }

    public String lastFailoverReason() {
        return lastFailoverReason;
    }

    public void addListener(BackendTransitionListener listener) {
        listeners.add(listener);
    }

    void recordPrimarySuccess() {
        lastPrimaryOkAt = clock.instant();
    }

    /**
     * Switches to FALLBACK.
     *
     * @return false when FALLBACK was already authoritative
     */
    public boolean failover(String reason) {
        writeLock.lock();
        try {
            if (current == BackendKind.FALLBACK) {
                return false;
            }
            current = BackendKind.FALLBACK;
            lastFailoverReason = reason == null ? "" : reason;
            lastReconcileAttemptAt = clock.instant();
        } finally {
            writeLock.unlock();
        }
        log.warn("backend failover PRIMARY -> FALLBACK reason={}", reason);
        sink.publish(MonitoringEvent.of(MonitoringEvent.FAILOVER, transitionFields(reason)));
        for (BackendTransitionListener listener : listeners) {
            listener.onFailover(reason);
        }
        return true;
    }

    /**
     * Probes the primary if FALLBACK is authoritative and the backoff has elapsed since the last
     * attempt, and reverts to PRIMARY when the probe succeeds.
     *
     * @return true when this call reverted to PRIMARY
     */
    public boolean tryReconcile() {
        if (current == BackendKind.PRIMARY) {
            return false;
        }
        writeLock.lock();
        try {
            if (current == BackendKind.PRIMARY) {
                return false;
            }
            Instant now = clock.instant();
            Instant last = lastReconcileAttemptAt;
            if (last != null && now.isBefore(last.plus(reconcileBackoff))) {
                return false;
            }
            lastReconcileAttemptAt = now;
            if (!probePrimary()) {
                log.info("reconcile probe failed, staying on FALLBACK next_attempt_after={}", now.plus(reconcileBackoff));
                return false;
            }
            current = BackendKind.PRIMARY;
        } finally {
            writeLock.unlock();
        }
        log.warn("backend failback FALLBACK -> PRIMARY");
        sink.publish(MonitoringEvent.of(MonitoringEvent.FAILBACK, transitionFields("reconciled")));
        for (BackendTransitionListener listener : listeners) {
            listener.onFailback();
        }
        return true;
    }

    /**
     * Schedules {@link #tryReconcile()} on a daemon thread once per backoff interval.
     */
    public synchronized void startBackgroundReconciliation() {
        if (reconciler != null) {
            return;
        }
        reconciler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "tcrimer-reconcile");
            t.setDaemon(true);
            return t;
        });
        long period = Math.max(1000L, reconcileBackoff.toMillis());
        reconciler.scheduleWithFixedDelay(() -> {
            try {
                tryReconcile();
            } catch (RuntimeException e) {
                log.error("background reconciliation failed: {}", e.toString(), e);
            }
        }, period, period, TimeUnit.MILLISECONDS);
    }

    @Override
    public synchronized void close() {
        if (reconciler != null) {
            reconciler.shutdownNow();
            reconciler = null;
        }
    }

    private boolean probePrimary() {
        try (Connection conn = primary.connect()) {
            boolean valid = conn.isValid(probeTimeoutSeconds);
            if (valid) {
                lastPrimaryOkAt = clock.instant();
            }
            return valid;
        } catch (SQLException e) {
            log.debug("primary probe failed: {}", e.getMessage());
            return false;
        }
    }

    private Map<String, Object> transitionFields(String reason) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("authoritative", current.name());
        fields.put("reason", reason == null ? "" : reason);
        fields.put("primary", primary.describe());
        fields.put("last_primary_ok_at", lastPrimaryOkAt == null ? null : lastPrimaryOkAt.toString());
        return fields;
    }
}
