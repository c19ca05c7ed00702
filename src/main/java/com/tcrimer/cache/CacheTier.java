package com.tcrimer.cache;

/**
 * Cache storage level. Lookups go MEMORY first, then SESSION.
 */
public enum CacheTier {
    MEMORY,
    SESSION
}
