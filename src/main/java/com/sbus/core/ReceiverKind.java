package com.sbus.core;

/**
 * The kinds of receiver an entity context keeps a slot for.
 */
public enum ReceiverKind {
    STREAMING,
    BATCHING,
    SESSION
}
