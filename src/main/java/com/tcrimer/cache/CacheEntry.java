package com.tcrimer.cache;

import java.time.Instant;

/**
 * One cached value in one tier. Only {@link CacheManager} creates and mutates entries,
 * always under its lock.
 */
public final class CacheEntry {
    private final String key;
    private final Object value;
    private final CacheTier tier;
    private final Instant createdAt;
    private final Instant expiresAt;
    private final long sizeBytes;
    private Instant lastAccessedAt;

    CacheEntry(String key, Object value, CacheTier tier, Instant createdAt, Instant expiresAt, long sizeBytes) {
        this.key = key;
        this.value = value;
        this.tier = tier;
        this.createdAt = createdAt;
        this.expiresAt = expiresAt;
        this.sizeBytes = Math.max(0L, sizeBytes);
        this.lastAccessedAt = createdAt;
    }

    public String key() {
        return key;
    }

    public Object value() {
        return value;
    }

    public CacheTier tier() {
        return tier;
    }

    public Instant createdAt() {
        return createdAt;
    }

    /**
     * Null when the entry never expires.
     */
    public Instant expiresAt() {
        return expiresAt;
    }

    public Instant lastAccessedAt() {
        return lastAccessedAt;
    }

    public long sizeBytes() {
        return sizeBytes;
    }

    boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    void touch(Instant now) {
        this.lastAccessedAt = now;
    }

    CacheEntry copyTo(CacheTier target, Instant now) {
        CacheEntry copy = new CacheEntry(key, value, target, createdAt, expiresAt, sizeBytes);
        copy.lastAccessedAt = now;
        return copy;
    }

    @Override
    public String toString() {
        return "CacheEntry{" + tier + " " + key + " size=" + sizeBytes + " expires=" + expiresAt + "}";
    }
}
