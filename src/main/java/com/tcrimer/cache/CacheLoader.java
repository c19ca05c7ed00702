package com.tcrimer.cache;

/**
 * Computation behind {@link CacheManager#getOrLoad}. The checked exception type flows through unchanged.
 */
@FunctionalInterface
public interface CacheLoader<T, E extends Exception> {
    T load() throws E;
}
