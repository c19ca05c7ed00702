package com.tcrimer.cache;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bounded LRU store for one tier. Not thread-safe; {@link CacheManager} serializes access.
 * <p>
 * Iteration order of the backing map is least recently accessed first, and entries that were
 * never read keep their insertion order, so evicting from the head removes the oldest
 * {@code lastAccessedAt} with ties going to the earliest insert.
 */
final class TierStore {
    private final CacheTier tier;
    private final int maxEntries;
    private final long maxBytes;
    private final LinkedHashMap<String, CacheEntry> entries = new LinkedHashMap<>(64, 0.75f, true);
    private long totalBytes;

    TierStore(CacheTier tier, int maxEntries, long maxBytes) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException(tier + " capacity must be positive: " + maxEntries);
        }
        this.tier = tier;
        this.maxEntries = maxEntries;
        this.maxBytes = maxBytes;
    }

    CacheTier tier() {
        return tier;
    }

    /**
     * Returns the live entry and marks it accessed; removes and reports expired ones through {@code expired}.
     */
    CacheEntry get(String key, Instant now, List<CacheEntry> expired) {
        CacheEntry entry = entries.get(key);
        if (entry == null) {
            return null;
        }
        if (entry.isExpired(now)) {
            remove(key);
            expired.add(entry);
            return null;
        }
        entry.touch(now);
        return entry;
    }

    boolean accepts(long sizeBytes) {
        return maxBytes <= 0L || sizeBytes <= maxBytes;
    }

    /**
     * Inserts or replaces, then evicts from the LRU end until both bounds hold.
     *
     * @return evicted entries, oldest first
     */
    List<CacheEntry> put(CacheEntry entry) {
        CacheEntry previous = entries.remove(entry.key());
        if (previous != null) {
            totalBytes -= previous.sizeBytes();
        }
        List<CacheEntry> evicted = new ArrayList<>();
        while (!entries.isEmpty() && overflowsWith(entry.sizeBytes())) {
            Iterator<Map.Entry<String, CacheEntry>> it = entries.entrySet().iterator();
            CacheEntry eldest = it.next().getValue();
            it.remove();
            totalBytes -= eldest.sizeBytes();
            evicted.add(eldest);
        }
        entries.put(entry.key(), entry);
        totalBytes += entry.sizeBytes();
        return evicted;
    }

    CacheEntry remove(String key) {
        CacheEntry removed = entries.remove(key);
        if (removed != null) {
            totalBytes -= removed.sizeBytes();
        }
        return removed;
    }

    int removePrefix(String prefix) {
        int removed = 0;
        Iterator<Map.Entry<String, CacheEntry>> it = entries.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, CacheEntry> next = it.next();
            if (next.getKey().startsWith(prefix)) {
                totalBytes -= next.getValue().sizeBytes();
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    int removeExpired(Instant now) {
        int removed = 0;
        Iterator<Map.Entry<String, CacheEntry>> it = entries.entrySet().iterator();
        while (it.hasNext()) {
            CacheEntry entry = it.next().getValue();
            if (entry.isExpired(now)) {
                totalBytes -= entry.sizeBytes();
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    int clear() {
        int size = entries.size();
        entries.clear();
        totalBytes = 0L;
        return size;
    }

    boolean containsKey(String key) {
        return entries.containsKey(key);
    }

    /**
     * Keys in eviction order without touching access times.
     */
    List<String> keysInEvictionOrder() {
        return new ArrayList<>(entries.keySet());
    }

    int size() {
        return entries.size();
    }

    long bytes() {
        return totalBytes;
    }

    private boolean overflowsWith(long incomingBytes) {
        if (entries.size() + 1 > maxEntries) {
            return true;
        }
        return maxBytes > 0L && totalBytes + incomingBytes > maxBytes;
    }
}
