package com.sbus.protocol.v10.connection;

import com.sbus.protocol.v10.transport.ErrorCondition;

import java.util.concurrent.CompletableFuture;

/**
 * A link attached by the transport, together with the session it was created on.
 */
public interface AmqpLink {

    String getName();

    boolean isOpen();

    /**
     * True once this side has requested the link to close.
     */
    boolean isClosedLocally();

    /**
     * True once this side has requested the link's session to end.
     */
    boolean isSessionClosedLocally();

    /**
     * Error the peer detached with, if any.
     */
    ErrorCondition getRemoteError();

    /**
     * Detach the link, end its session and drop both from the transport's cache.
     */
    CompletableFuture<Void> close();
}
