package com.sbus.events;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A structured record of something that happened to a link entity.
 */
public class EntityEvent {

    public enum EventType {
        // Link lifecycle
        LINK_OPENED,
        LINK_OPEN_FAILED,
        LINK_CLOSED,
        LINK_DETACHED,
        RECONNECT_STARTED,
        RECONNECT_EXHAUSTED,
        TOKEN_RENEWED,

        // Message intake
        MESSAGE_RECEIVED,
        MESSAGE_RELEASED,
        BATCH_RESOLVED,

        // Locks
        LOCK_RENEWED,
        LOCK_RENEWAL_FAILED,
        SESSION_ACCEPTED,

        // Settlement
        SETTLEMENT_SENT,
        SETTLEMENT_ACKNOWLEDGED,
        SETTLEMENT_REJECTED,
        SETTLEMENT_TIMED_OUT,
        SETTLEMENT_ABANDONED
    }

    private final EventType type;
    private final Instant timestamp;
    private final String connectionId;
    private final String entityName;
    private final String address;
    private final Map<String, Object> details;

    private EntityEvent(Builder builder) {
        this.type = builder.type;
        this.timestamp = builder.timestamp != null ? builder.timestamp : Instant.now();
        this.connectionId = builder.connectionId;
        this.entityName = builder.entityName;
        this.address = builder.address;
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(builder.details));
    }

    public static Builder builder(EventType type) {
        return new Builder(type);
    }

    public EventType getType() {
        return type;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getConnectionId() {
        return connectionId;
    }

    public String getEntityName() {
        return entityName;
    }

    public String getAddress() {
        return address;
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    public Object getDetail(String key) {
        return details.get(key);
    }

    /**
     * Flat representation used for serialization.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("timestamp", timestamp.toString());
        map.put("type", type.name());
        map.put("connectionId", connectionId);
        map.put("entity", entityName);
        map.put("address", address);
        if (!details.isEmpty()) {
            map.put("details", details);
        }
        return map;
    }

    @Override
    public String toString() {
        return timestamp + " [" + type + "] " + connectionId + " " + entityName + " " + details;
    }

    public static class Builder {
        private final EventType type;
        private Instant timestamp;
        private String connectionId;
        private String entityName;
        private String address;
        private final Map<String, Object> details = new LinkedHashMap<>();

        private Builder(EventType type) {
            this.type = type;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder connectionId(String connectionId) {
            this.connectionId = connectionId;
            return this;
        }

        public Builder entity(String entityName, String address) {
            this.entityName = entityName;
            this.address = address;
            return this;
        }

        /**
         * Add a detail; values other than numbers, booleans and strings are stored as their string form.
         */
        public Builder detail(String key, Object value) {
            if (value == null) {
                return this;
            }
            if (value instanceof Number || value instanceof Boolean || value instanceof String) {
                details.put(key, value);
            } else {
                details.put(key, value.toString());
            }
            return this;
        }

        public EntityEvent build() {
            return new EntityEvent(this);
        }
    }
}
