package com.tcrimer.cache;

/**
 * Result of {@link CacheManager#get(String)}. {@code tier} is the tier that answered, or null on a miss.
 */
public record CacheLookup(Object value, boolean hit, CacheTier tier) {
    private static final CacheLookup MISS = new CacheLookup(null, false, null);

    public static CacheLookup miss() {
        return MISS;
    }

    static CacheLookup hit(Object value, CacheTier tier) {
        return new CacheLookup(value, true, tier);
    }

    public <T> T valueAs(Class<T> type) {
        if (!hit || !type.isInstance(value)) {
            return null;
        }
        return type.cast(value);
    }
}
