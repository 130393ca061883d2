package com.sbus.protocol.v10.messaging;

import com.sbus.protocol.v10.types.Symbol;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An AMQP 1.0 message as handed over by the transport, with its sections already
 * decoded: the header delivery count, the properties used by the broker, the
 * message annotations and application properties, and the body value.
 */
public class AmqpMessage {

    // Broker message annotations
    public static final Symbol LOCKED_UNTIL = Symbol.valueOf("x-opt-locked-until");
    public static final Symbol SEQUENCE_NUMBER = Symbol.valueOf("x-opt-sequence-number");
    public static final Symbol ENQUEUED_TIME = Symbol.valueOf("x-opt-enqueued-time");
    public static final Symbol PARTITION_KEY = Symbol.valueOf("x-opt-partition-key");
    public static final Symbol DEAD_LETTER_SOURCE = Symbol.valueOf("x-opt-deadletter-source");
    public static final Symbol LOCK_TOKEN = Symbol.valueOf("x-opt-lock-token");

    private Object messageId;
    private Object correlationId;
    private String groupId;
    private String subject;
    private String to;
    private String replyTo;
    private String contentType;
    private Long ttlMillis;
    private long deliveryCount;
    private final Map<Symbol, Object> messageAnnotations = new LinkedHashMap<>();
    private final Map<String, Object> applicationProperties = new LinkedHashMap<>();
    private Object body;

    public Object getMessageId() {
        return messageId;
    }

    public AmqpMessage setMessageId(Object messageId) {
        this.messageId = messageId;
        return this;
    }

    public Object getCorrelationId() {
        return correlationId;
    }

    public AmqpMessage setCorrelationId(Object correlationId) {
        this.correlationId = correlationId;
        return this;
    }

    /**
     * The group id carries the session id of a session-enabled entity.
     */
    public String getGroupId() {
        return groupId;
    }

    public AmqpMessage setGroupId(String groupId) {
        this.groupId = groupId;
        return this;
    }

    public String getSubject() {
        return subject;
    }

    public AmqpMessage setSubject(String subject) {
        this.subject = subject;
        return this;
    }

    public String getTo() {
        return to;
    }

    public AmqpMessage setTo(String to) {
        this.to = to;
        return this;
    }

    public String getReplyTo() {
        return replyTo;
    }

    public AmqpMessage setReplyTo(String replyTo) {
        this.replyTo = replyTo;
        return this;
    }

    public String getContentType() {
        return contentType;
    }

    public AmqpMessage setContentType(String contentType) {
        this.contentType = contentType;
        return this;
    }

    public Long getTtlMillis() {
        return ttlMillis;
    }

    public AmqpMessage setTtlMillis(Long ttlMillis) {
        this.ttlMillis = ttlMillis;
        return this;
    }

    public long getDeliveryCount() {
        return deliveryCount;
    }

    public AmqpMessage setDeliveryCount(long deliveryCount) {
        this.deliveryCount = deliveryCount;
        return this;
    }

    public Map<Symbol, Object> getMessageAnnotations() {
        return Collections.unmodifiableMap(messageAnnotations);
    }

    public Object getMessageAnnotation(Symbol key) {
        return messageAnnotations.get(key);
    }

    public AmqpMessage setMessageAnnotation(Symbol key, Object value) {
        messageAnnotations.put(key, value);
        return this;
    }

    public Map<String, Object> getApplicationProperties() {
        return Collections.unmodifiableMap(applicationProperties);
    }

    public AmqpMessage setApplicationProperties(Map<String, Object> properties) {
        applicationProperties.clear();
        if (properties != null) {
            applicationProperties.putAll(properties);
        }
        return this;
    }

    public Object getBody() {
        return body;
    }

    public AmqpMessage setBody(Object body) {
        this.body = body;
        return this;
    }

    @Override
    public String toString() {
        return String.format("AmqpMessage{messageId=%s, groupId=%s, deliveryCount=%d}",
                messageId, groupId, deliveryCount);
    }
}
