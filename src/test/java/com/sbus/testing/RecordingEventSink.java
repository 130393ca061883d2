package com.sbus.testing;

import com.sbus.events.EntityEvent;
import com.sbus.events.EntityEventSink;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

public class RecordingEventSink implements EntityEventSink {

    private final List<EntityEvent> events = new ArrayList<>();

    @Override
    public void record(EntityEvent event) {
        events.add(event);
    }

    public List<EntityEvent> getEvents() {
        return events;
    }

    public List<EntityEvent.EventType> types() {
        return events.stream().map(EntityEvent::getType).collect(Collectors.toList());
    }

    public long count(EntityEvent.EventType type) {
        return events.stream().filter(e -> e.getType() == type).count();
    }
}
