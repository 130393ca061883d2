package com.sbus.events;

/**
 * Receives entity events. Implementations must not throw and must not block;
 * what they do never changes the outcome of the operation that emitted the event.
 */
@FunctionalInterface
public interface EntityEventSink {

    EntityEventSink NOOP = event -> { };

    void record(EntityEvent event);
}
