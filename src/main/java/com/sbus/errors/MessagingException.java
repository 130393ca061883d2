package com.sbus.errors;

import com.sbus.protocol.v10.types.Symbol;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;

/**
 * Domain error every transport failure is translated into before any policy looks at it.
 */
public class MessagingException extends RuntimeException {

    private final MessagingErrorCode code;
    private final Symbol condition;
    private final boolean retryable;
    private final Map<Symbol, Object> info;

    public MessagingException(MessagingErrorCode code, String message) {
        this(code, code.getCondition(), message, code.isRetryable(), null, null);
    }

    public MessagingException(MessagingErrorCode code, String message, Throwable cause) {
        this(code, code.getCondition(), message, code.isRetryable(), null, cause);
    }

    public MessagingException(MessagingErrorCode code, Symbol condition, String message,
                              boolean retryable, Map<Symbol, Object> info, Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code");
        this.condition = condition;
        this.retryable = retryable;
        this.info = info == null ? Collections.emptyMap() : Collections.unmodifiableMap(info);
    }

    public MessagingErrorCode getCode() {
        return code;
    }

    /**
     * The AMQP condition the error was raised with, null for client side failures.
     */
    public Symbol getCondition() {
        return condition;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public Map<Symbol, Object> getInfo() {
        return info;
    }

    public boolean isLockLost() {
        return code == MessagingErrorCode.MESSAGE_LOCK_LOST;
    }

    @Override
    public String toString() {
        return String.format("MessagingException{code=%s, condition=%s, retryable=%s, message='%s'}",
                code, condition, retryable, getMessage());
    }
}
