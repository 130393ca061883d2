package com.sbus.management;

import com.sbus.core.DispositionOptions;
import com.sbus.core.DispositionType;
import com.sbus.core.ReceiveMode;
import com.sbus.protocol.v10.messaging.AmqpMessage;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Request/response channel to the entity's {@code $management} node.
 */
public interface ManagementClient {

    String getEntityPath();

    /**
     * Renew the lock of a peek-locked message.
     *
     * @return the new lock expiry
     */
    CompletableFuture<Instant> renewLock(UUID lockToken);

    /**
     * Renew the lock of an accepted session.
     *
     * @return the new session lock expiry
     */
    CompletableFuture<Instant> renewSessionLock(String sessionId);

    /**
     * Settle a message whose lock was obtained over this channel.
     */
    CompletableFuture<Void> updateDispositionStatus(UUID lockToken, DispositionType type, DispositionOptions options);

    /**
     * Fetch deferred messages by sequence number. In peek-lock mode each returned
     * message carries its lock token in the {@code x-opt-lock-token} annotation.
     */
    CompletableFuture<List<AmqpMessage>> receiveDeferredMessages(Collection<Long> sequenceNumbers, ReceiveMode mode);

    CompletableFuture<Void> close();
}
