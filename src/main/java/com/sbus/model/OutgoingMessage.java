package com.sbus.model;

import com.sbus.protocol.v10.messaging.AmqpMessage;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

public class OutgoingMessage {

    private Object body;
    private Object messageId;
    private Object correlationId;
    private String sessionId;
    private String label;
    private String to;
    private String replyTo;
    private String contentType;
    private Duration timeToLive;
    private String partitionKey;
    private final Map<String, Object> userProperties = new LinkedHashMap<>();

    public OutgoingMessage() {
    }

    public OutgoingMessage(Object body) {
        this.body = body;
    }

    public Object getBody() {
        return body;
    }

    public OutgoingMessage setBody(Object body) {
        this.body = body;
        return this;
    }

    public Object getMessageId() {
        return messageId;
    }

    public OutgoingMessage setMessageId(Object messageId) {
        this.messageId = messageId;
        return this;
    }

    public Object getCorrelationId() {
        return correlationId;
    }

    public OutgoingMessage setCorrelationId(Object correlationId) {
        this.correlationId = correlationId;
        return this;
    }

    public String getSessionId() {
        return sessionId;
    }

    public OutgoingMessage setSessionId(String sessionId) {
        this.sessionId = sessionId;
        return this;
    }

    public String getLabel() {
        return label;
    }

    public OutgoingMessage setLabel(String label) {
        this.label = label;
        return this;
    }

    public String getTo() {
        return to;
    }

    public OutgoingMessage setTo(String to) {
        this.to = to;
        return this;
    }

    public String getReplyTo() {
        return replyTo;
    }

    public OutgoingMessage setReplyTo(String replyTo) {
        this.replyTo = replyTo;
        return this;
    }

    public String getContentType() {
        return contentType;
    }

    public OutgoingMessage setContentType(String contentType) {
        this.contentType = contentType;
        return this;
    }

    public Duration getTimeToLive() {
        return timeToLive;
    }

    public OutgoingMessage setTimeToLive(Duration timeToLive) {
        this.timeToLive = timeToLive;
        return this;
    }

    public String getPartitionKey() {
        return partitionKey;
    }

    public OutgoingMessage setPartitionKey(String partitionKey) {
        this.partitionKey = partitionKey;
        return this;
    }

    public Map<String, Object> getUserProperties() {
        return userProperties;
    }

    public OutgoingMessage setUserProperty(String key, Object value) {
        userProperties.put(key, value);
        return this;
    }

    public AmqpMessage toAmqpMessage() {
        AmqpMessage message = new AmqpMessage()
                .setBody(body)
                .setMessageId(messageId)
                .setCorrelationId(correlationId)
                .setGroupId(sessionId)
                .setSubject(label)
                .setTo(to)
                .setReplyTo(replyTo)
                .setContentType(contentType)
                .setApplicationProperties(userProperties);
        if (timeToLive != null) {
            message.setTtlMillis(timeToLive.toMillis());
        }
        if (partitionKey != null) {
            message.setMessageAnnotation(AmqpMessage.PARTITION_KEY, partitionKey);
        }
        return message;
    }
}
