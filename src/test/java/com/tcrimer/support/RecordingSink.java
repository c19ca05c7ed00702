package com.tcrimer.support;

import com.tcrimer.core.MonitoringEvent;
import com.tcrimer.core.MonitoringSink;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

public final class RecordingSink implements MonitoringSink {
    public final List<MonitoringEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void publish(MonitoringEvent event) {
        events.add(event);
    }

    public List<MonitoringEvent> ofType(String type) {
        return events.stream().filter(e -> e.type().equals(type)).collect(Collectors.toList());
    }
}
