package com.sbus.protocol.v10.connection;

/**
 * Lifecycle of a client link entity.
 */
public enum LinkState {
    /**
     * No link; either never opened or closed by the application.
     */
    CLOSED,

    /**
     * An establishment attempt (claim negotiation and attach) is outstanding.
     */
    CONNECTING,

    /**
     * The link was closed by the peer and a decision to reopen is pending or
     * reconnect attempts are being made.
     */
    DETACHED,

    /**
     * Link is attached and usable.
     */
    OPEN;

    /**
     * True while an establishment or reconnection is under way.
     */
    public boolean isConnecting() {
        return this == CONNECTING || this == DETACHED;
    }
}
