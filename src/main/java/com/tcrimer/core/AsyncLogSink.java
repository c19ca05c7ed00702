package com.tcrimer.core;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Writes monitoring events as JSON lines to the {@code EVENTS} logger from a daemon thread.
 * {@link #publish} only offers to a bounded queue; overflow is dropped and counted.
 */
public final class AsyncLogSink implements MonitoringSink, AutoCloseable {
    private static final Logger EVENTS_LOG = LogManager.getLogger("EVENTS");

    private final BlockingQueue<MonitoringEvent> queue;
    private final AtomicLong dropped = new AtomicLong(0L);
    private final AtomicLong written = new AtomicLong(0L);
    private final AtomicBoolean running = new AtomicBoolean(true);
    private final Thread worker;

    public AsyncLogSink(int capacity) {
        this.queue = new ArrayBlockingQueue<>(Math.max(16, capacity));
        this.worker = new Thread(this::drainLoop, "tcrimer-events");
        this.worker.setDaemon(true);
        this.worker.start();
    }

    @Override
    public void publish(MonitoringEvent event) {
        if (event == null || !running.get()) {
            return;
        }
        if (!queue.offer(event)) {
            dropped.incrementAndGet();
        }
    }

    public long droppedCount() {
        return dropped.get();
    }

    public long writtenCount() {
        return written.get();
    }

    private void drainLoop() {
        while (running.get() || !queue.isEmpty()) {
            try {
                MonitoringEvent event = queue.poll(200, TimeUnit.MILLISECONDS);
                if (event != null) {
                    write(event);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        MonitoringEvent rest;
        while ((rest = queue.poll()) != null) {
            write(rest);
        }
    }

    private void write(MonitoringEvent event) {
        try {
            EVENTS_LOG.info(event.toJsonLine());
            written.incrementAndGet();
        } catch (RuntimeException e) {
            dropped.incrementAndGet();
        }
    }

    @Override
    public void close() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        try {
            worker.join(2000L);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        long lost = dropped.get();
        if (lost > 0L) {
            EVENTS_LOG.warn("event sink closed written={} dropped={}", written.get(), lost);
        }
    }
}
