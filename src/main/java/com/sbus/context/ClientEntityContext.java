package com.sbus.context;

import com.sbus.core.BatchingReceiver;
import com.sbus.core.LinkEntity;
import com.sbus.core.MessageReceiver;
import com.sbus.core.MessageSender;
import com.sbus.core.StreamingReceiver;
import com.sbus.management.ManagementClient;
import com.sbus.session.MessageSession;
import com.sbus.util.ConcurrentExpiringMap;
import com.sbus.util.EventLoop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-client registry of the link entities of one entity path: at most one sender,
 * one streaming receiver and one batching receiver, plus the accepted sessions by
 * session id. It also holds the lock tokens of messages received over the
 * management channel, which must be settled over that channel too.
 */
public class ClientEntityContext {

    private static final Logger log = LoggerFactory.getLogger(ClientEntityContext.class);

    private final ConnectionContext connectionContext;
    private final String entityPath;
    private final String clientId;
    private final ConcurrentExpiringMap<UUID, Instant> requestResponseLockedMessages;

    private volatile MessageSender sender;
    private volatile StreamingReceiver streamingReceiver;
    private volatile BatchingReceiver batchingReceiver;
    private final Map<String, MessageSession> messageSessions = new ConcurrentHashMap<>();

    ClientEntityContext(ConnectionContext connectionContext, String entityPath) {
        this.connectionContext = Objects.requireNonNull(connectionContext, "connectionContext");
        this.entityPath = Objects.requireNonNull(entityPath, "entityPath");
        this.clientId = entityPath + "-" + UUID.randomUUID();
        this.requestResponseLockedMessages = new ConcurrentExpiringMap<>(connectionContext.getEventLoop(),
                connectionContext.getConfig().getLockStoreSweepInterval());
    }

    public ConnectionContext getConnectionContext() {
        return connectionContext;
    }

    public EventLoop getEventLoop() {
        return connectionContext.getEventLoop();
    }

    public String getEntityPath() {
        return entityPath;
    }

    public String getClientId() {
        return clientId;
    }

    public String getAudience() {
        return connectionContext.audienceFor(entityPath);
    }

    public ManagementClient getManagementClient() {
        return connectionContext.managementClientFor(entityPath);
    }

    /**
     * Lock tokens of messages received over the management channel, valued by their lock expiry.
     */
    public ConcurrentExpiringMap<UUID, Instant> getRequestResponseLockedMessages() {
        return requestResponseLockedMessages;
    }

    public MessageSender getSender() {
        return sender;
    }

    public StreamingReceiver getStreamingReceiver() {
        return streamingReceiver;
    }

    public BatchingReceiver getBatchingReceiver() {
        return batchingReceiver;
    }

    public Map<String, MessageSession> getMessageSessions() {
        return Collections.unmodifiableMap(messageSessions);
    }

    public synchronized boolean registerSender(MessageSender candidate) {
        if (sender != null && sender != candidate) {
            log.debug("[{}] Sender slot of '{}' is taken by '{}', not registering '{}'",
                    connectionId(), entityPath, sender.getName(), candidate.getName());
            return false;
        }
        sender = candidate;
        return true;
    }

    public synchronized void deregisterSender(MessageSender candidate) {
        if (sender == candidate) {
            sender = null;
        }
    }

    /**
     * Register an opened receiver in the slot of its kind.
     *
     * @return false if the slot already holds another receiver
     */
    public synchronized boolean registerReceiver(MessageReceiver receiver) {
        switch (receiver.getKind()) {
            case STREAMING:
                if (streamingReceiver != null && streamingReceiver != receiver) {
                    return slotTaken(receiver, streamingReceiver);
                }
                streamingReceiver = (StreamingReceiver) receiver;
                return true;
            case BATCHING:
                if (batchingReceiver != null && batchingReceiver != receiver) {
                    return slotTaken(receiver, batchingReceiver);
                }
                batchingReceiver = (BatchingReceiver) receiver;
                return true;
            case SESSION:
                MessageSession session = (MessageSession) receiver;
                String sessionId = session.getSessionId();
                if (sessionId == null) {
                    log.warn("[{}] Session receiver '{}' has no session id, not registering",
                            connectionId(), receiver.getName());
                    return false;
                }
                MessageSession existing = messageSessions.putIfAbsent(sessionId, session);
                if (existing != null && existing != session) {
                    return slotTaken(receiver, existing);
                }
                return true;
            default:
                throw new IllegalArgumentException("Unknown receiver kind: " + receiver.getKind());
        }
    }

    private boolean slotTaken(MessageReceiver candidate, MessageReceiver holder) {
        log.debug("[{}] {} slot of '{}' is taken by '{}', not registering '{}'",
                connectionId(), candidate.getKind(), entityPath, holder.getName(), candidate.getName());
        return false;
    }

    public synchronized void deregisterReceiver(MessageReceiver receiver) {
        switch (receiver.getKind()) {
            case STREAMING:
                if (streamingReceiver == receiver) {
                    streamingReceiver = null;
                }
                break;
            case BATCHING:
                if (batchingReceiver == receiver) {
                    batchingReceiver = null;
                }
                break;
            case SESSION:
                String sessionId = ((MessageSession) receiver).getSessionId();
                if (sessionId != null) {
                    messageSessions.remove(sessionId, receiver);
                }
                break;
            default:
                throw new IllegalArgumentException("Unknown receiver kind: " + receiver.getKind());
        }
    }

    /**
     * Look up a registered receiver by link name.
     */
    public MessageReceiver getReceiver(String name) {
        for (MessageReceiver receiver : registeredReceivers()) {
            if (receiver.getName().equals(name)) {
                return receiver;
            }
        }
        return null;
    }

    private List<MessageReceiver> registeredReceivers() {
        List<MessageReceiver> receivers = new ArrayList<>();
        if (batchingReceiver != null) {
            receivers.add(batchingReceiver);
        }
        if (streamingReceiver != null) {
            receivers.add(streamingReceiver);
        }
        receivers.addAll(messageSessions.values());
        return receivers;
    }

    /**
     * The connection failed: reopen every registered entity that is not already
     * reconnecting. The sender goes first, then the batching receiver, the
     * streaming receiver and the sessions. A failure of one does not stop the others.
     */
    public CompletableFuture<Void> detached(Throwable error) {
        List<LinkEntity<?>> entities = new ArrayList<>();
        if (sender != null) {
            entities.add(sender);
        }
        entities.addAll(registeredReceivers());
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (LinkEntity<?> entity : entities) {
            chain = chain.thenCompose(v -> detachEntity(entity, error));
        }
        return chain;
    }

    private CompletableFuture<Void> detachEntity(LinkEntity<?> entity, Throwable error) {
        if (entity.isConnecting()) {
            log.debug("[{}] '{}' is already reconnecting, skipping", connectionId(), entity.getName());
            return CompletableFuture.completedFuture(null);
        }
        return entity.detached(error).handle((v, e) -> {
            if (e != null) {
                log.error("[{}] An error occurred while reconnecting '{}': {}",
                        connectionId(), entity.getName(), e.toString());
            }
            return null;
        });
    }

    /**
     * Close every entity of the client and forget the stored lock tokens.
     */
    public CompletableFuture<Void> close() {
        List<LinkEntity<?>> entities = new ArrayList<>();
        if (sender != null) {
            entities.add(sender);
        }
        entities.addAll(registeredReceivers());
        CompletableFuture<?>[] closing = entities.stream()
                .map(entity -> entity.close().exceptionally(e -> {
                    log.warn("[{}] Error closing '{}'", connectionId(), entity.getName(), e);
                    return null;
                }))
                .toArray(CompletableFuture[]::new);
        return CompletableFuture.allOf(closing).thenRun(requestResponseLockedMessages::close);
    }

    private String connectionId() {
        return connectionContext.getConnectionId();
    }
}
