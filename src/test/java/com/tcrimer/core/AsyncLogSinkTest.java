package com.tcrimer.core;

import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AsyncLogSinkTest {

    @Test
    void closeShouldFlushEveryQueuedEvent() {
        AsyncLogSink sink = new AsyncLogSink(64);
        for (int i = 0; i < 10; i++) {
            sink.publish(MonitoringEvent.of(MonitoringEvent.CACHE_STATS, Map.of("i", i)));
        }

        sink.close();

        assertEquals(10L, sink.writtenCount() + sink.droppedCount());
        assertEquals(0L, sink.droppedCount());
    }

    @Test
    void publishAfterCloseShouldBeIgnored() {
        AsyncLogSink sink = new AsyncLogSink(16);
        sink.close();

        sink.publish(MonitoringEvent.of(MonitoringEvent.FAILOVER, Map.of()));

        assertEquals(0L, sink.writtenCount());
        assertEquals(0L, sink.droppedCount());
    }

    @Test
    void jsonLineShouldCarryTypeTimestampAndFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("backend", "PRIMARY");
        fields.put("last_primary_ok_at", null);
        MonitoringEvent event = new MonitoringEvent(MonitoringEvent.FAILBACK, Instant.parse("2024-01-01T00:00:00Z"), fields);

        JSONObject json = new JSONObject(event.toJsonLine());

        assertEquals("FAILBACK", json.getString("type"));
        assertEquals("2024-01-01T00:00:00Z", json.getString("at"));
        assertEquals("PRIMARY", json.getString("backend"));
        assertTrue(json.isNull("last_primary_ok_at"));
    }
}
