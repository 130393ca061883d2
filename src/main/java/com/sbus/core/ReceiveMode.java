package com.sbus.core;

public enum ReceiveMode {
    /**
     * The message stays on the broker, locked for this receiver, until it is settled
     * or its lock expires.
     */
    PEEK_LOCK,

    /**
     * The broker deletes the message as it is delivered.
     */
    RECEIVE_AND_DELETE
}
