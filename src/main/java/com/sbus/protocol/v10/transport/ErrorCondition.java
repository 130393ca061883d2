package com.sbus.protocol.v10.transport;

import com.sbus.protocol.v10.types.Symbol;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * AMQP 1.0 Error condition as reported by the peer on detach, end, close or a
 * rejected disposition.
 *
 * Fields:
 * 0: condition (symbol, mandatory) - Error condition identifier
 * 1: description (string) - Human-readable description
 * 2: info (map) - Additional error information
 */
public class ErrorCondition {

    // Standard AMQP error conditions
    public static final Symbol INTERNAL_ERROR = Symbol.valueOf("amqp:internal-error");
    public static final Symbol NOT_FOUND = Symbol.valueOf("amqp:not-found");
    public static final Symbol UNAUTHORIZED_ACCESS = Symbol.valueOf("amqp:unauthorized-access");
    public static final Symbol DECODE_ERROR = Symbol.valueOf("amqp:decode-error");
    public static final Symbol RESOURCE_LIMIT_EXCEEDED = Symbol.valueOf("amqp:resource-limit-exceeded");
    public static final Symbol NOT_ALLOWED = Symbol.valueOf("amqp:not-allowed");
    public static final Symbol INVALID_FIELD = Symbol.valueOf("amqp:invalid-field");
    public static final Symbol NOT_IMPLEMENTED = Symbol.valueOf("amqp:not-implemented");
    public static final Symbol RESOURCE_LOCKED = Symbol.valueOf("amqp:resource-locked");
    public static final Symbol PRECONDITION_FAILED = Symbol.valueOf("amqp:precondition-failed");
    public static final Symbol RESOURCE_DELETED = Symbol.valueOf("amqp:resource-deleted");
    public static final Symbol ILLEGAL_STATE = Symbol.valueOf("amqp:illegal-state");
    public static final Symbol FRAME_SIZE_TOO_SMALL = Symbol.valueOf("amqp:frame-size-too-small");

    // Connection errors
    public static final Symbol CONNECTION_FORCED = Symbol.valueOf("amqp:connection:forced");
    public static final Symbol FRAMING_ERROR = Symbol.valueOf("amqp:connection:framing-error");
    public static final Symbol REDIRECT = Symbol.valueOf("amqp:connection:redirect");

    // Session errors
    public static final Symbol WINDOW_VIOLATION = Symbol.valueOf("amqp:session:window-violation");
    public static final Symbol ERRANT_LINK = Symbol.valueOf("amqp:session:errant-link");
    public static final Symbol HANDLE_IN_USE = Symbol.valueOf("amqp:session:handle-in-use");
    public static final Symbol UNATTACHED_HANDLE = Symbol.valueOf("amqp:session:unattached-handle");

    // Link errors
    public static final Symbol DETACH_FORCED = Symbol.valueOf("amqp:link:detach-forced");
    public static final Symbol TRANSFER_LIMIT_EXCEEDED = Symbol.valueOf("amqp:link:transfer-limit-exceeded");
    public static final Symbol MESSAGE_SIZE_EXCEEDED = Symbol.valueOf("amqp:link:message-size-exceeded");
    public static final Symbol LINK_REDIRECT = Symbol.valueOf("amqp:link:redirect");
    public static final Symbol STOLEN = Symbol.valueOf("amqp:link:stolen");

    // Broker specific conditions
    public static final Symbol TIMEOUT = Symbol.valueOf("com.microsoft:timeout");
    public static final Symbol SERVER_BUSY = Symbol.valueOf("com.microsoft:server-busy");
    public static final Symbol ARGUMENT_ERROR = Symbol.valueOf("com.microsoft:argument-error");
    public static final Symbol ARGUMENT_OUT_OF_RANGE = Symbol.valueOf("com.microsoft:argument-out-of-range");
    public static final Symbol ENTITY_DISABLED = Symbol.valueOf("com.microsoft:entity-disabled");
    public static final Symbol ENTITY_ALREADY_EXISTS = Symbol.valueOf("com.microsoft:entity-already-exists");
    public static final Symbol MESSAGE_LOCK_LOST = Symbol.valueOf("com.microsoft:message-lock-lost");
    public static final Symbol SESSION_LOCK_LOST = Symbol.valueOf("com.microsoft:session-lock-lost");
    public static final Symbol SESSION_CANNOT_BE_LOCKED = Symbol.valueOf("com.microsoft:session-cannot-be-locked");
    public static final Symbol MESSAGE_NOT_FOUND = Symbol.valueOf("com.microsoft:message-not-found");
    public static final Symbol STORE_LOCK_LOST = Symbol.valueOf("com.microsoft:store-lock-lost");
    public static final Symbol OPERATION_CANCELLED = Symbol.valueOf("com.microsoft:operation-cancelled");
    public static final Symbol PUBLISHER_REVOKED = Symbol.valueOf("com.microsoft:publisher-revoked");
    public static final Symbol NO_MATCHING_SUBSCRIPTION = Symbol.valueOf("com.microsoft:no-matching-subscription");
    public static final Symbol DEAD_LETTER = Symbol.valueOf("com.microsoft:dead-letter");

    private final Symbol condition;
    private String description;
    private Map<Symbol, Object> info;

    public ErrorCondition(Symbol condition) {
        this.condition = Objects.requireNonNull(condition, "condition is required");
    }

    public ErrorCondition(Symbol condition, String description) {
        this(condition);
        this.description = description;
    }

    public Symbol getCondition() {
        return condition;
    }

    public String getDescription() {
        return description;
    }

    public Map<Symbol, Object> getInfo() {
        return info == null ? Collections.emptyMap() : Collections.unmodifiableMap(info);
    }

    public ErrorCondition setDescription(String description) {
        this.description = description;
        return this;
    }

    public ErrorCondition setInfo(Map<Symbol, Object> info) {
        this.info = info == null ? null : new LinkedHashMap<>(info);
        return this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ErrorCondition)) return false;
        ErrorCondition that = (ErrorCondition) o;
        return condition.equals(that.condition)
                && Objects.equals(description, that.description)
                && Objects.equals(info, that.info);
    }

    @Override
    public int hashCode() {
        return Objects.hash(condition, description, info);
    }

    @Override
    public String toString() {
        return String.format("Error{condition=%s, description='%s'}", condition, description);
    }
}
