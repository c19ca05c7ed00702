package com.tcrimer.core;

/**
 * Receiver of structured monitoring events. Implementations must not block the caller.
 */
@FunctionalInterface
public interface MonitoringSink {

    void publish(MonitoringEvent event);

    static MonitoringSink noop() {
        return event -> {
        };
    }
}
