package com.sbus.client;

import com.sbus.context.ClientEntityContext;
import com.sbus.context.ConnectionContext;
import com.sbus.core.BatchingReceiver;
import com.sbus.core.ErrorHandler;
import com.sbus.core.MessageHandler;
import com.sbus.core.MessageHandlerOptions;
import com.sbus.core.MessageSender;
import com.sbus.core.ReceiveMode;
import com.sbus.core.ReceiveOptions;
import com.sbus.core.StreamingReceiver;
import com.sbus.model.OutgoingMessage;
import com.sbus.model.ReceivedMessage;
import com.sbus.protocol.v10.connection.LinkState;
import com.sbus.session.MessageSession;
import com.sbus.session.SessionReceiverOptions;
import com.sbus.util.ConcurrentExpiringMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Client of one queue: sends, receives by handler or in batches, accepts sessions
 * and fetches deferred messages.
 */
public class QueueClient {

    private static final Logger log = LoggerFactory.getLogger(QueueClient.class);

    private final ConnectionContext connectionContext;
    private final ClientEntityContext context;
    private final ReceiveMode receiveMode;

    private MessageSender sender;
    private StreamingReceiver streamingReceiver;
    private BatchingReceiver batchingReceiver;
    private volatile boolean closed;

    QueueClient(ConnectionContext connectionContext, String entityPath, ReceiveMode receiveMode) {
        this.connectionContext = connectionContext;
        this.context = connectionContext.createEntityContext(entityPath);
        this.receiveMode = receiveMode != null ? receiveMode : ReceiveMode.PEEK_LOCK;
    }

    public String getEntityPath() {
        return context.getEntityPath();
    }

    public ReceiveMode getReceiveMode() {
        return receiveMode;
    }

    public ClientEntityContext getContext() {
        return context;
    }

    public boolean isClosed() {
        return closed;
    }

    public CompletableFuture<Void> send(OutgoingMessage message) {
        ensureOpen();
        synchronized (this) {
            if (sender == null) {
                sender = new MessageSender(context);
            }
            return sender.send(message);
        }
    }

    /**
     * Start pushing messages to {@code onMessage}.
     *
     * @throws IllegalStateException if a handler is already receiving on this client
     */
    public synchronized ReceiveHandler receive(MessageHandler onMessage, ErrorHandler onError,
                                               MessageHandlerOptions options) {
        ensureOpen();
        if (streamingReceiver != null && streamingReceiver.getState() != LinkState.CLOSED) {
            throw new IllegalStateException("A receiver named '" + streamingReceiver.getName()
                    + "' is already receiving messages on '" + getEntityPath() + "'.");
        }
        streamingReceiver = new StreamingReceiver(context,
                new ReceiveOptions().setReceiveMode(receiveMode).applyHandlerOptions(options));
        streamingReceiver.receive(onMessage, onError).whenComplete((v, e) -> {
            if (e != null) {
                log.warn("[{}] Streaming receive on '{}' failed to start: {}",
                        connectionContext.getConnectionId(), getEntityPath(), e.toString());
            }
        });
        return new ReceiveHandler(streamingReceiver);
    }

    /**
     * Receive up to {@code maxMessageCount} messages, waiting at most {@code maxWaitTime}.
     */
    public CompletableFuture<List<ReceivedMessage>> receiveBatch(int maxMessageCount, Duration maxWaitTime) {
        ensureOpen();
        BatchingReceiver receiver;
        synchronized (this) {
            if (batchingReceiver == null) {
                batchingReceiver = new BatchingReceiver(context, new ReceiveOptions().setReceiveMode(receiveMode));
            }
            receiver = batchingReceiver;
        }
        return receiver.receive(maxMessageCount, maxWaitTime);
    }

    /**
     * Accept a session; the next available one when no session id is given.
     */
    public CompletableFuture<MessageSession> acceptSession(SessionReceiverOptions options) {
        ensureOpen();
        SessionReceiverOptions sessionOptions = options != null
                ? options : new SessionReceiverOptions().setReceiveMode(receiveMode);
        return new MessageSession(context, sessionOptions).accept();
    }

    /**
     * Renew the lock of a peek-locked message.
     */
    public CompletableFuture<Instant> renewLock(ReceivedMessage message) {
        ensureOpen();
        return message.renewLock();
    }

    /**
     * Fetch deferred messages by sequence number. In peek-lock mode their lock
     * tokens are remembered until the locks expire, so settling them goes over the
     * management channel.
     */
    public CompletableFuture<List<ReceivedMessage>> receiveDeferredMessages(Collection<Long> sequenceNumbers) {
        ensureOpen();
        Objects.requireNonNull(sequenceNumbers, "sequenceNumbers");
        return context.getManagementClient().receiveDeferredMessages(sequenceNumbers, receiveMode)
                .thenApply(messages -> {
                    List<ReceivedMessage> received = new ArrayList<>();
                    ConcurrentExpiringMap<UUID, Instant> lockStore = context.getRequestResponseLockedMessages();
                    Instant now = context.getEventLoop().now();
                    messages.forEach(amqpMessage -> {
                        ReceivedMessage message = ReceivedMessage.fromManagement(amqpMessage, context, receiveMode);
                        UUID lockToken = message.getLockToken();
                        Instant lockedUntil = message.getLockedUntil();
                        if (receiveMode == ReceiveMode.PEEK_LOCK && lockToken != null && lockedUntil != null
                                && lockedUntil.isAfter(now)) {
                            lockStore.set(lockToken, lockedUntil, Duration.between(now, lockedUntil));
                        }
                        received.add(message);
                    });
                    log.debug("[{}] Received {} deferred messages from '{}'",
                            connectionContext.getConnectionId(), received.size(), getEntityPath());
                    return received;
                });
    }

    public CompletableFuture<ReceivedMessage> receiveDeferredMessage(long sequenceNumber) {
        return receiveDeferredMessages(List.of(sequenceNumber))
                .thenApply(messages -> messages.isEmpty() ? null : messages.get(0));
    }

    /**
     * Close every link of this client.
     */
    public CompletableFuture<Void> close() {
        if (closed) {
            return CompletableFuture.completedFuture(null);
        }
        closed = true;
        List<CompletableFuture<Void>> closing = new ArrayList<>();
        synchronized (this) {
            if (sender != null) {
                closing.add(sender.close());
            }
            if (streamingReceiver != null) {
                closing.add(streamingReceiver.close());
            }
            if (batchingReceiver != null) {
                closing.add(batchingReceiver.close());
            }
        }
        closing.add(context.close());
        return CompletableFuture.allOf(closing.toArray(new CompletableFuture[0]))
                .thenCompose(v -> connectionContext.removeEntityContext(context))
                .thenRun(() -> log.info("[{}] Closed client of '{}'",
                        connectionContext.getConnectionId(), getEntityPath()));
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("The client of '" + getEntityPath() + "' has been closed.");
        }
    }
}
