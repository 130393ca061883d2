package com.sbus.model;

import com.sbus.context.ClientEntityContext;
import com.sbus.core.DispositionOptions;
import com.sbus.core.DispositionType;
import com.sbus.core.MessageReceiver;
import com.sbus.core.ReceiveMode;
import com.sbus.protocol.v10.connection.IncomingDelivery;
import com.sbus.protocol.v10.messaging.AmqpMessage;
import com.sbus.util.ConcurrentExpiringMap;
import com.sbus.util.LockTokens;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * A message received from an entity, with the settlement operations of its lock.
 *
 * Messages delivered on a receiver link are settled through that link. Messages
 * fetched over the management channel, or whose lock token is held in the
 * client's lock store, are settled over the management channel.
 */
public class ReceivedMessage {

    private static final Logger log = LoggerFactory.getLogger(ReceivedMessage.class);

    private final AmqpMessage message;
    private final IncomingDelivery delivery;
    private final MessageReceiver receiver;
    private final ClientEntityContext context;
    private final ReceiveMode receiveMode;
    private final UUID lockToken;
    private volatile Instant lockedUntil;
    private volatile boolean settlementRequested;
    private volatile boolean settled;

    private ReceivedMessage(AmqpMessage message, IncomingDelivery delivery, MessageReceiver receiver,
                            ClientEntityContext context, ReceiveMode receiveMode, UUID lockToken) {
        this.message = Objects.requireNonNull(message, "message");
        this.delivery = delivery;
        this.receiver = receiver;
        this.context = Objects.requireNonNull(context, "context");
        this.receiveMode = Objects.requireNonNull(receiveMode, "receiveMode");
        this.lockToken = lockToken;
        this.lockedUntil = toInstant(message.getMessageAnnotation(AmqpMessage.LOCKED_UNTIL));
        this.settled = receiveMode == ReceiveMode.RECEIVE_AND_DELETE;
    }

    /**
     * A message delivered on a receiver link. In peek-lock mode its lock token is the delivery tag.
     */
    public static ReceivedMessage fromDelivery(AmqpMessage message, IncomingDelivery delivery,
                                               MessageReceiver receiver, ClientEntityContext context,
                                               ReceiveMode receiveMode) {
        Objects.requireNonNull(delivery, "delivery");
        UUID lockToken = receiveMode == ReceiveMode.PEEK_LOCK ? LockTokens.fromDeliveryTag(delivery.getTag()) : null;
        return new ReceivedMessage(message, delivery, receiver, context, receiveMode, lockToken);
    }

    /**
     * A message returned by the management channel. Its lock token travels in an annotation.
     */
    public static ReceivedMessage fromManagement(AmqpMessage message, ClientEntityContext context,
                                                 ReceiveMode receiveMode) {
        Object token = message.getMessageAnnotation(AmqpMessage.LOCK_TOKEN);
        UUID lockToken = null;
        if (token instanceof UUID) {
            lockToken = (UUID) token;
        } else if (token != null) {
            lockToken = UUID.fromString(token.toString());
        }
        return new ReceivedMessage(message, null, null, context, receiveMode, lockToken);
    }

    public CompletableFuture<Void> complete() {
        return settle(DispositionType.COMPLETE, new DispositionOptions());
    }

    public CompletableFuture<Void> abandon() {
        return abandon(null);
    }

    /**
     * Release the lock so the message can be received again, optionally modifying properties.
     */
    public CompletableFuture<Void> abandon(Map<String, Object> propertiesToModify) {
        return settle(DispositionType.ABANDON, new DispositionOptions().setPropertiesToModify(propertiesToModify));
    }

    public CompletableFuture<Void> defer() {
        return defer(null);
    }

    /**
     * Set the message aside; it can only be received again by its sequence number.
     */
    public CompletableFuture<Void> defer(Map<String, Object> propertiesToModify) {
        return settle(DispositionType.DEFER, new DispositionOptions().setPropertiesToModify(propertiesToModify));
    }

    public CompletableFuture<Void> deadLetter() {
        return deadLetter(new DeadLetterOptions());
    }

    public CompletableFuture<Void> deadLetter(DeadLetterOptions options) {
        DeadLetterOptions deadLetter = options != null ? options : new DeadLetterOptions();
        return settle(DispositionType.DEADLETTER, new DispositionOptions().setError(deadLetter.toErrorCondition()));
    }

    private CompletableFuture<Void> settle(DispositionType type, DispositionOptions options) {
        if (receiveMode != ReceiveMode.PEEK_LOCK) {
            return CompletableFuture.failedFuture(new IllegalStateException(
                    "The operation '" + type.operation() + "' is not supported in ReceiveAndDelete mode."));
        }
        if (settled) {
            return CompletableFuture.failedFuture(new IllegalStateException(
                    "The message with id '" + message.getMessageId() + "' has already been settled."));
        }
        settlementRequested = true;
        CompletableFuture<Void> settlement;
        ConcurrentExpiringMap<UUID, Instant> lockStore = context.getRequestResponseLockedMessages();
        if (delivery == null || (lockToken != null && lockStore.has(lockToken))) {
            if (lockToken == null) {
                return CompletableFuture.failedFuture(new IllegalStateException(
                        "The message with id '" + message.getMessageId() + "' has no lock token."));
            }
            log.debug("[{}] Settling message '{}' with {} over the management channel",
                    context.getConnectionContext().getConnectionId(), message.getMessageId(), type);
            settlement = context.getManagementClient().updateDispositionStatus(lockToken, type, options)
                    .thenRun(() -> lockStore.remove(lockToken));
        } else {
            settlement = receiver.settleMessage(delivery, type, options);
        }
        return settlement.whenComplete((v, e) -> {
            if (e != null) {
                // A failed settlement leaves the message to be settled again
                settlementRequested = false;
            } else {
                settled = true;
            }
        });
    }

    /**
     * Renew the lock of this message over the management channel.
     *
     * @return the new lock expiry
     */
    public CompletableFuture<Instant> renewLock() {
        if (receiveMode != ReceiveMode.PEEK_LOCK || lockToken == null) {
            return CompletableFuture.failedFuture(new IllegalStateException(
                    "The message with id '" + message.getMessageId() + "' holds no lock to renew."));
        }
        return context.getManagementClient().renewLock(lockToken).thenApply(until -> {
            lockedUntil = until;
            ConcurrentExpiringMap<UUID, Instant> lockStore = context.getRequestResponseLockedMessages();
            if (lockStore.has(lockToken)) {
                Duration ttl = Duration.between(context.getEventLoop().now(), until);
                if (!ttl.isNegative() && !ttl.isZero()) {
                    lockStore.set(lockToken, until, ttl);
                }
            }
            return until;
        });
    }

    static Instant toInstant(Object value) {
        if (value instanceof Instant) {
            return (Instant) value;
        }
        if (value instanceof Date) {
            return ((Date) value).toInstant();
        }
        if (value instanceof Number) {
            return Instant.ofEpochMilli(((Number) value).longValue());
        }
        return null;
    }

    public AmqpMessage getAmqpMessage() {
        return message;
    }

    public IncomingDelivery getDelivery() {
        return delivery;
    }

    public ReceiveMode getReceiveMode() {
        return receiveMode;
    }

    public Object getBody() {
        return message.getBody();
    }

    public Object getMessageId() {
        return message.getMessageId();
    }

    public Object getCorrelationId() {
        return message.getCorrelationId();
    }

    public String getSessionId() {
        return message.getGroupId();
    }

    public String getLabel() {
        return message.getSubject();
    }

    public String getContentType() {
        return message.getContentType();
    }

    public Map<String, Object> getUserProperties() {
        return message.getApplicationProperties();
    }

    public long getDeliveryCount() {
        return message.getDeliveryCount();
    }

    public Long getSequenceNumber() {
        Object value = message.getMessageAnnotation(AmqpMessage.SEQUENCE_NUMBER);
        return value instanceof Number ? ((Number) value).longValue() : null;
    }

    public Instant getEnqueuedTime() {
        return toInstant(message.getMessageAnnotation(AmqpMessage.ENQUEUED_TIME));
    }

    public UUID getLockToken() {
        return lockToken;
    }

    public Instant getLockedUntil() {
        return lockedUntil;
    }

    public void setLockedUntil(Instant lockedUntil) {
        this.lockedUntil = lockedUntil;
    }

    /**
     * True once the message can no longer be settled: it was received in
     * ReceiveAndDelete mode or a settlement was acknowledged.
     */
    public boolean isSettled() {
        return settled;
    }

    /**
     * True while a settlement is pending or once one succeeded.
     */
    public boolean isSettlementRequested() {
        return settlementRequested;
    }

    @Override
    public String toString() {
        return String.format("ReceivedMessage{messageId=%s, sessionId=%s, lockToken=%s, lockedUntil=%s}",
                message.getMessageId(), message.getGroupId(), lockToken, lockedUntil);
    }
}
