package com.sbus.protocol.v10.connection;

import com.sbus.protocol.v10.delivery.DeliveryState;
import com.sbus.protocol.v10.messaging.AmqpMessage;

import java.util.concurrent.CompletableFuture;

/**
 * A sending link.
 */
public interface SenderLink extends AmqpLink {

    boolean isSendable();

    /**
     * Transfer a message; completes with the outcome the peer settled it with.
     */
    CompletableFuture<DeliveryState> send(AmqpMessage message);
}
