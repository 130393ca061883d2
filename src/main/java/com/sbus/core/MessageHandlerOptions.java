package com.sbus.core;

import java.time.Duration;

/**
 * Options of a message handler. Unset values fall back to the client configuration.
 */
public class MessageHandlerOptions {

    private Integer maxConcurrentCalls;
    private Boolean autoComplete;
    private Duration maxAutoRenewDuration;

    /**
     * Number of messages the handler may be processing at once.
     */
    public Integer getMaxConcurrentCalls() {
        return maxConcurrentCalls;
    }

    public MessageHandlerOptions setMaxConcurrentCalls(int maxConcurrentCalls) {
        if (maxConcurrentCalls < 1) {
            throw new IllegalArgumentException("maxConcurrentCalls must be at least 1: " + maxConcurrentCalls);
        }
        this.maxConcurrentCalls = maxConcurrentCalls;
        return this;
    }

    /**
     * Complete the message once the handler succeeds, unless the handler settled it.
     */
    public Boolean getAutoComplete() {
        return autoComplete;
    }

    public MessageHandlerOptions setAutoComplete(boolean autoComplete) {
        this.autoComplete = autoComplete;
        return this;
    }

    /**
     * How long, from arrival, the lock of a message is kept renewed. Zero disables renewal.
     */
    public Duration getMaxAutoRenewDuration() {
        return maxAutoRenewDuration;
    }

    public MessageHandlerOptions setMaxAutoRenewDuration(Duration maxAutoRenewDuration) {
        if (maxAutoRenewDuration == null || maxAutoRenewDuration.isNegative()) {
            throw new IllegalArgumentException("maxAutoRenewDuration must not be negative: " + maxAutoRenewDuration);
        }
        this.maxAutoRenewDuration = maxAutoRenewDuration;
        return this;
    }
}
