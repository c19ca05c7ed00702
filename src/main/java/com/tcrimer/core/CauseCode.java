package com.tcrimer.core;

/**
 * Machine-readable reason attached to a failed {@link Outcome}.
 */
public enum CauseCode {
    NONE,
    INSUFFICIENT_DATA,
    NO_BARS,
    INVALID_PARAMS,
    DATA_FAULT,
    UPSTREAM_TIMEOUT,
    POOL_EXHAUSTED,
    RUNTIME_ERROR
}
