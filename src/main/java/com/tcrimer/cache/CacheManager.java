package com.tcrimer.cache;

import com.tcrimer.core.MonitoringEvent;
import com.tcrimer.core.MonitoringSink;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Two-tier (MEMORY, SESSION) LRU cache with per-entry TTL.
 * <p>
 * Reads check MEMORY, then SESSION; a SESSION hit is copied into MEMORY. Each tier evicts
 * synchronously on insert, least recently accessed first. Expired entries read as misses and are
 * dropped when touched, or by the optional sweep.
 * <p>
 * The cache fails open: an internal fault is logged, counted as degraded, and reported to the
 * caller as a miss. Callers never lock; every mutation runs under one internal lock.
 */
public final class CacheManager implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(CacheManager.class);

    private final CacheSettings settings;
    private final Clock clock;
    private final ValueSizer sizer;
    private final MonitoringSink sink;
    private final ReentrantLock lock = new ReentrantLock();
    private final TierStore memory;
    private final TierStore session;
    private final ScheduledExecutorService sweeper;

    private long hits;
    private long misses;
    private long evictions;
    private long expirations;
    private long degraded;

    public CacheManager(CacheSettings settings) {
        this(settings, Clock.systemUTC(), ValueSizer.estimating(), MonitoringSink.noop());
    }

    public CacheManager(CacheSettings settings, Clock clock, ValueSizer sizer, MonitoringSink sink) {
        this.settings = settings;
        this.clock = clock;
        this.sizer = sizer;
        this.sink = sink == null ? MonitoringSink.noop() : sink;
        this.memory = new TierStore(CacheTier.MEMORY, settings.getMemoryMaxEntries(), settings.getMemoryMaxBytes());
        this.session = new TierStore(CacheTier.SESSION, settings.getSessionMaxEntries(), settings.getSessionMaxBytes());
        this.sweeper = startSweeper(settings.getSweepInterval());
    }

    public CacheLookup get(String key) {
        if (key == null) {
            return CacheLookup.miss();
        }
        lock.lock();
        try {
            Instant now = clock.instant();
            List<CacheEntry> expired = new ArrayList<>(2);
            CacheEntry entry = memory.get(key, now, expired);
            if (entry != null) {
                hits++;
                return CacheLookup.hit(entry.value(), CacheTier.MEMORY);
            }
            entry = session.get(key, now, expired);
            expirations += expired.size();
            if (entry != null) {
                hits++;
                promote(entry, now);
                return CacheLookup.hit(entry.value(), CacheTier.SESSION);
            }
            misses++;
            return CacheLookup.miss();
        } catch (RuntimeException e) {
            degrade("get", key, e);
            return CacheLookup.miss();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Puts into MEMORY with the default TTL.
     */
    public void put(String key, Object value) {
        put(key, value, null, CacheTier.MEMORY);
    }

    /**
     * Stores {@code value} in {@code tier} and removes any copy of the key from the other tier.
     *
     * @param ttl null for the configured default; zero or negative for no expiry
     */
    public void put(String key, Object value, Duration ttl, CacheTier tier) {
        if (key == null || value == null) {
            return;
        }
        lock.lock();
        try {
            Instant now = clock.instant();
            long size = sizer.sizeOf(value);
            TierStore target = store(tier);
            TierStore other = tier == CacheTier.MEMORY ? session : memory;
            other.remove(key);
            if (!target.accepts(size)) {
                target.remove(key);
                log.debug("cache skip key={} tier={} size={} exceeds tier byte bound", key, tier, size);
                return;
            }
            CacheEntry entry = new CacheEntry(key, value, tier, now, expiryOf(ttl, now), size);
            recordEvictions(target.put(entry));
        } catch (RuntimeException e) {
            degrade("put", key, e);
        } finally {
            lock.unlock();
        }
    }

    public boolean invalidate(String key) {
        if (key == null) {
            return false;
        }
        lock.lock();
        try {
            boolean fromMemory = memory.remove(key) != null;
            boolean fromSession = session.remove(key) != null;
            return fromMemory || fromSession;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes every key starting with {@code prefix} from both tiers.
     *
     * @return number of entries removed
     */
    public int invalidatePrefix(String prefix) {
        if (prefix == null || prefix.isEmpty()) {
            return 0;
        }
        lock.lock();
        try {
            int removed = memory.removePrefix(prefix) + session.removePrefix(prefix);
            if (removed > 0) {
                log.debug("cache invalidate prefix={} removed={}", prefix, removed);
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the cached value of {@code type} for {@code key}, or runs {@code loader} and caches
     * a non-null result. Loads run outside the lock, so two callers racing on one key may both load;
     * the later put wins. A loader exception propagates and nothing is cached.
     */
    public <T, E extends Exception> T getOrLoad(String key, Class<T> type, CacheTier tier, Duration ttl,
                                                CacheLoader<? extends T, E> loader) throws E {
        CacheLookup lookup = get(key);
        T cached = lookup.valueAs(type);
        if (cached != null) {
            return cached;
        }
        T loaded = loader.load();
        if (loaded != null) {
            put(key, loaded, ttl, tier);
        }
        return loaded;
    }

    /**
     * Drops expired entries from both tiers.
     *
     * @return number removed
     */
    public int cleanupExpired() {
        lock.lock();
        try {
            Instant now = clock.instant();
            int removed = memory.removeExpired(now) + session.removeExpired(now);
            expirations += removed;
            return removed;
        } catch (RuntimeException e) {
            degrade("cleanup", "*", e);
            return 0;
        } finally {
            lock.unlock();
        }
    }

    public int clear() {
        lock.lock();
        try {
            return memory.clear() + session.clear();
        } finally {
            lock.unlock();
        }
    }

    public CacheStats stats() {
        lock.lock();
        try {
            return CacheStats.builder()
                    .hits(hits)
                    .misses(misses)
                    .evictions(evictions)
                    .expirations(expirations)
                    .degraded(degraded)
                    .memoryEntries(memory.size())
                    .memoryBytes(memory.bytes())
                    .sessionEntries(session.size())
                    .sessionBytes(session.bytes())
                    .build();
        } finally {
            lock.unlock();
        }
    }

    public void publishStats() {
        sink.publish(MonitoringEvent.of(MonitoringEvent.CACHE_STATS, stats().toFields()));
    }

    /**
     * Keys of one tier, next eviction victim first. Does not count as access.
     */
    public List<String> keys(CacheTier tier) {
        lock.lock();
        try {
            return store(tier).keysInEvictionOrder();
        } finally {
            lock.unlock();
        }
    }

    public boolean contains(String key, CacheTier tier) {
        lock.lock();
        try {
            return store(tier).containsKey(key);
        } finally {
            lock.unlock();
        }
    }

    public CacheSettings settings() {
        return settings;
    }

    @Override
    public void close() {
        if (sweeper != null) {
            sweeper.shutdownNow();
        }
    }

    private void promote(CacheEntry entry, Instant now) {
        if (!memory.accepts(entry.sizeBytes())) {
            return;
        }
        recordEvictions(memory.put(entry.copyTo(CacheTier.MEMORY, now)));
    }

    private void recordEvictions(List<CacheEntry> evicted) {
        if (evicted.isEmpty()) {
            return;
        }
        evictions += evicted.size();
        if (log.isDebugEnabled()) {
            for (CacheEntry entry : evicted) {
                log.debug("cache evict tier={} key={} last_access={}", entry.tier(), entry.key(), entry.lastAccessedAt());
            }
        }
    }

    private Instant expiryOf(Duration ttl, Instant now) {
        Duration effective = ttl == null ? settings.getDefaultTtl() : ttl;
        if (effective == null || effective.isZero() || effective.isNegative()) {
            return null;
        }
        return now.plus(effective);
    }

    private TierStore store(CacheTier tier) {
        return tier == CacheTier.SESSION ? session : memory;
    }

    private void degrade(String op, String key, RuntimeException e) {
        degraded++;
        log.warn("cache degraded op={} key={} err={}", op, key, e.toString());
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("op", op);
        fields.put("key", key);
        fields.put("error", e.getClass().getSimpleName());
        try {
            sink.publish(MonitoringEvent.of(MonitoringEvent.CACHE_DEGRADED, fields));
        } catch (RuntimeException sinkError) {
            log.debug("monitoring sink rejected cache event: {}", sinkError.toString());
        }
    }

    private ScheduledExecutorService startSweeper(Duration interval) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            return null;
        }
        ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "tcrimer-cache-sweep");
            t.setDaemon(true);
            return t;
        });
        long millis = interval.toMillis();
        executor.scheduleWithFixedDelay(() -> {
            int removed = cleanupExpired();
            if (removed > 0) {
                log.debug("cache sweep removed={}", removed);
            }
        }, millis, millis, TimeUnit.MILLISECONDS);
        return executor;
    }
}
