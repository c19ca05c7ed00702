package com.tcrimer.db.pool;

/**
 * Notified after the authoritative backend changes. Called on the thread that made the change.
 */
public interface BackendTransitionListener {

    default void onFailover(String reason) {
    }

    default void onFailback() {
    }
}
