package com.sbus.session;

import com.sbus.core.ReceiveMode;

import java.time.Duration;

/**
 * Options of a session receiver.
 */
public class SessionReceiverOptions {

    private String sessionId;
    private ReceiveMode receiveMode = ReceiveMode.PEEK_LOCK;
    private Duration maxSessionAutoRenewLockDuration;

    /**
     * The session to accept; null accepts the next available session.
     */
    public String getSessionId() {
        return sessionId;
    }

    public SessionReceiverOptions setSessionId(String sessionId) {
        this.sessionId = sessionId;
        return this;
    }

    public ReceiveMode getReceiveMode() {
        return receiveMode;
    }

    public SessionReceiverOptions setReceiveMode(ReceiveMode receiveMode) {
        this.receiveMode = receiveMode == null ? ReceiveMode.PEEK_LOCK : receiveMode;
        return this;
    }

    /**
     * How long the session lock is kept renewed after the session is accepted. Zero disables renewal.
     */
    public Duration getMaxSessionAutoRenewLockDuration() {
        return maxSessionAutoRenewLockDuration;
    }

    public SessionReceiverOptions setMaxSessionAutoRenewLockDuration(Duration duration) {
        if (duration == null || duration.isNegative()) {
            throw new IllegalArgumentException("maxSessionAutoRenewLockDuration must not be negative: " + duration);
        }
        this.maxSessionAutoRenewLockDuration = duration;
        return this;
    }
}
