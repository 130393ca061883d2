package com.sbus.events;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.Set;

/**
 * Writes every event as one JSON line to the {@code ENTITY_EVENTS} logger.
 * Failure events are logged at WARN, everything else at DEBUG.
 */
public class JsonLogEventSink implements EntityEventSink {

    private static final Logger log = LoggerFactory.getLogger(JsonLogEventSink.class);
    private static final Logger eventLog = LoggerFactory.getLogger("ENTITY_EVENTS");

    private static final Set<EntityEvent.EventType> WARN_TYPES = EnumSet.of(
            EntityEvent.EventType.LINK_OPEN_FAILED,
            EntityEvent.EventType.LINK_DETACHED,
            EntityEvent.EventType.RECONNECT_EXHAUSTED,
            EntityEvent.EventType.LOCK_RENEWAL_FAILED,
            EntityEvent.EventType.SETTLEMENT_REJECTED,
            EntityEvent.EventType.SETTLEMENT_TIMED_OUT,
            EntityEvent.EventType.SETTLEMENT_ABANDONED);

    private final ObjectMapper objectMapper;

    public JsonLogEventSink() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
    }

    @Override
    public void record(EntityEvent event) {
        boolean warn = WARN_TYPES.contains(event.getType());
        if (warn ? !eventLog.isWarnEnabled() : !eventLog.isDebugEnabled()) {
            return;
        }
        String line = toJson(event);
        if (warn) {
            eventLog.warn(line);
        } else {
            eventLog.debug(line);
        }
    }

    String toJson(EntityEvent event) {
        try {
            return objectMapper.writeValueAsString(event.toMap());
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize event {}", event.getType(), e);
            return event.toString();
        }
    }
}
