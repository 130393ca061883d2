package com.sbus.errors;

import com.sbus.protocol.v10.transport.ErrorCondition;
import com.sbus.protocol.v10.types.Symbol;

import java.util.HashMap;
import java.util.Map;

/**
 * Stable error names for the AMQP and broker error conditions, each with the
 * retry classification used by the retry orchestrator and the detach protocol.
 */
public enum MessagingErrorCode {

    INTERNAL_SERVER_ERROR(ErrorCondition.INTERNAL_ERROR, true),
    SERVER_BUSY(ErrorCondition.SERVER_BUSY, true),
    SERVICE_UNAVAILABLE(ErrorCondition.TIMEOUT, true),
    OPERATION_CANCELLED(ErrorCondition.OPERATION_CANCELLED, true),
    DETACH_FORCED(ErrorCondition.DETACH_FORCED, true),
    CONNECTION_FORCED(ErrorCondition.CONNECTION_FORCED, true),
    TRANSFER_LIMIT_EXCEEDED(ErrorCondition.TRANSFER_LIMIT_EXCEEDED, true),

    ENTITY_NOT_FOUND(ErrorCondition.NOT_FOUND, false),
    UNAUTHORIZED(ErrorCondition.UNAUTHORIZED_ACCESS, false),
    DECODE_ERROR(ErrorCondition.DECODE_ERROR, false),
    QUOTA_EXCEEDED(ErrorCondition.RESOURCE_LIMIT_EXCEEDED, false),
    INVALID_OPERATION(ErrorCondition.NOT_ALLOWED, false),
    INVALID_FIELD(ErrorCondition.INVALID_FIELD, false),
    NOT_IMPLEMENTED(ErrorCondition.NOT_IMPLEMENTED, false),
    RESOURCE_LOCKED(ErrorCondition.RESOURCE_LOCKED, false),
    PRECONDITION_FAILED(ErrorCondition.PRECONDITION_FAILED, false),
    RESOURCE_DELETED(ErrorCondition.RESOURCE_DELETED, false),
    ILLEGAL_STATE(ErrorCondition.ILLEGAL_STATE, false),
    FRAME_SIZE_TOO_SMALL(ErrorCondition.FRAME_SIZE_TOO_SMALL, false),
    FRAMING_ERROR(ErrorCondition.FRAMING_ERROR, false),
    CONNECTION_REDIRECT(ErrorCondition.REDIRECT, false),
    WINDOW_VIOLATION(ErrorCondition.WINDOW_VIOLATION, false),
    ERRANT_LINK(ErrorCondition.ERRANT_LINK, false),
    HANDLE_IN_USE(ErrorCondition.HANDLE_IN_USE, false),
    UNATTACHED_HANDLE(ErrorCondition.UNATTACHED_HANDLE, false),
    MESSAGE_TOO_LARGE(ErrorCondition.MESSAGE_SIZE_EXCEEDED, false),
    LINK_REDIRECT(ErrorCondition.LINK_REDIRECT, false),
    LINK_STOLEN(ErrorCondition.STOLEN, false),
    ARGUMENT_ERROR(ErrorCondition.ARGUMENT_ERROR, false),
    ARGUMENT_OUT_OF_RANGE(ErrorCondition.ARGUMENT_OUT_OF_RANGE, false),
    ENTITY_DISABLED(ErrorCondition.ENTITY_DISABLED, false),
    ENTITY_ALREADY_EXISTS(ErrorCondition.ENTITY_ALREADY_EXISTS, false),
    MESSAGE_LOCK_LOST(ErrorCondition.MESSAGE_LOCK_LOST, false),
    SESSION_LOCK_LOST(ErrorCondition.SESSION_LOCK_LOST, false),
    SESSION_CANNOT_BE_LOCKED(ErrorCondition.SESSION_CANNOT_BE_LOCKED, false),
    MESSAGE_NOT_FOUND(ErrorCondition.MESSAGE_NOT_FOUND, false),
    STORE_LOCK_LOST(ErrorCondition.STORE_LOCK_LOST, false),
    PUBLISHER_REVOKED(ErrorCondition.PUBLISHER_REVOKED, false),
    NO_MATCHING_SUBSCRIPTION(ErrorCondition.NO_MATCHING_SUBSCRIPTION, false),

    // Not tied to a condition symbol
    SERVICE_COMMUNICATION_ERROR(null, true),
    OPERATION_TIMEOUT(null, true),
    MESSAGING_ERROR(null, true),
    CLIENT_ERROR(null, false);

    private static final Map<Symbol, MessagingErrorCode> BY_CONDITION = new HashMap<>();

    static {
        for (MessagingErrorCode code : values()) {
            if (code.condition != null) {
                BY_CONDITION.put(code.condition, code);
            }
        }
    }

    private final Symbol condition;
    private final boolean retryable;

    MessagingErrorCode(Symbol condition, boolean retryable) {
        this.condition = condition;
        this.retryable = retryable;
    }

    public Symbol getCondition() {
        return condition;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /**
     * Unknown conditions map to the generic, retryable {@link #MESSAGING_ERROR}.
     */
    public static MessagingErrorCode fromCondition(Symbol condition) {
        if (condition == null) {
            return MESSAGING_ERROR;
        }
        return BY_CONDITION.getOrDefault(condition, MESSAGING_ERROR);
    }
}
