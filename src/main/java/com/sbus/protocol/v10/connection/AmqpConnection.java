package com.sbus.protocol.v10.connection;

import java.util.concurrent.CompletableFuture;

/**
 * The underlying AMQP connection. Each link is created on its own session.
 */
public interface AmqpConnection {

    String getConnectionId();

    boolean isOpen();

    /**
     * Attach a receiver link. The future fails with an
     * {@link com.sbus.protocol.v10.transport.AmqpErrorException} when the peer refuses it.
     */
    CompletableFuture<ReceiverLink> createReceiver(ReceiverLinkOptions options, ReceiverEvents events);

    /**
     * Attach a sender link.
     */
    CompletableFuture<SenderLink> createSender(SenderLinkOptions options, LinkEvents events);
}
