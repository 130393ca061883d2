package com.sbus.core;

import com.sbus.context.ClientEntityContext;
import com.sbus.errors.ErrorTranslator;
import com.sbus.errors.MessagingErrorCode;
import com.sbus.errors.MessagingException;
import com.sbus.events.EntityEvent.EventType;
import com.sbus.model.ReceivedMessage;
import com.sbus.protocol.v10.connection.IncomingDelivery;
import com.sbus.protocol.v10.connection.LinkState;
import com.sbus.protocol.v10.connection.ReceiverEvents;
import com.sbus.protocol.v10.connection.ReceiverLink;
import com.sbus.protocol.v10.connection.ReceiverLinkOptions;
import com.sbus.protocol.v10.delivery.DeliveryState;
import com.sbus.protocol.v10.delivery.Modified;
import com.sbus.protocol.v10.delivery.Rejected;
import com.sbus.protocol.v10.messaging.AmqpMessage;
import com.sbus.protocol.v10.transport.ErrorCondition;
import com.sbus.retry.RetryOperationType;
import com.sbus.util.Names;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Receiver link entity: turns deliveries into {@link ReceivedMessage}s, runs the
 * application handler with lock renewal and automatic settlement, and tracks
 * every disposition until the peer acknowledges it or it times out.
 */
public abstract class MessageReceiver extends LinkEntity<ReceiverLink> {

    private static final Logger log = LoggerFactory.getLogger(MessageReceiver.class);

    /**
     * How long a disposition waits for the peer's acknowledgement. A disposition
     * that times out is treated as successful.
     */
    public static final Duration DISPOSITION_TIMEOUT = Duration.ofSeconds(20);

    private final ReceiverKind kind;
    protected final ReceiveMode receiveMode;
    protected volatile int maxConcurrentCalls;
    protected volatile boolean autoComplete;
    protected volatile Duration maxAutoRenewDuration;

    // Keyed by delivery id
    private final Map<Long, PendingSettlement> deliveryDispositionMap = new ConcurrentHashMap<>();
    private final Map<ReceivedMessage, LockRenewalTask> lockRenewals = new ConcurrentHashMap<>();

    protected volatile ErrorHandler onError;

    private BatchCollector pendingBatch;

    protected MessageReceiver(ClientEntityContext context, ReceiverKind kind, ReceiveOptions options) {
        super(options.getName() != null ? options.getName() : Names.uniqueName(context.getEntityPath()),
                context, context.getEntityPath(), context.getAudience());
        this.kind = Objects.requireNonNull(kind, "kind");
        this.receiveMode = options.getReceiveMode();
        this.maxConcurrentCalls = options.getMaxConcurrentCalls() != null
                ? options.getMaxConcurrentCalls() : config.getMaxConcurrentCalls();
        this.autoComplete = options.getAutoComplete() != null
                ? options.getAutoComplete() : config.isAutoComplete();
        this.maxAutoRenewDuration = options.getMaxAutoRenewDuration() != null
                ? options.getMaxAutoRenewDuration() : config.getMaxAutoRenewDuration();
    }

    /**
     * Override the handler settings with the ones set in {@code options}.
     */
    protected void applyHandlerOptions(MessageHandlerOptions options) {
        if (options == null) {
            return;
        }
        if (options.getMaxConcurrentCalls() != null) {
            maxConcurrentCalls = options.getMaxConcurrentCalls();
        }
        if (options.getAutoComplete() != null) {
            autoComplete = options.getAutoComplete();
        }
        if (options.getMaxAutoRenewDuration() != null) {
            maxAutoRenewDuration = options.getMaxAutoRenewDuration();
        }
    }

    public ReceiverKind getKind() {
        return kind;
    }

    public ReceiveMode getReceiveMode() {
        return receiveMode;
    }

    public int getMaxConcurrentCalls() {
        return maxConcurrentCalls;
    }

    public boolean isAutoComplete() {
        return autoComplete;
    }

    /**
     * Locks are renewed automatically only in peek-lock mode with a positive renewal window.
     */
    public boolean isAutoRenewLock() {
        return receiveMode == ReceiveMode.PEEK_LOCK && maxAutoRenewDuration.compareTo(Duration.ZERO) > 0;
    }

    public int getPendingSettlementCount() {
        return deliveryDispositionMap.size();
    }

    public int getActiveLockRenewalCount() {
        return lockRenewals.size();
    }

    @Override
    protected RetryOperationType linkOperationType() {
        return RetryOperationType.RECEIVER_LINK;
    }

    /**
     * Peek-lock links leave deliveries unsettled and settle in the second mode;
     * receive-and-delete links ask for pre-settled deliveries.
     */
    protected ReceiverLinkOptions createReceiverOptions() {
        ReceiverLinkOptions options = new ReceiverLinkOptions(getName(), getAddress());
        if (receiveMode == ReceiveMode.PEEK_LOCK) {
            options.setSndSettleMode(ReceiverLinkOptions.SND_UNSETTLED)
                    .setRcvSettleMode(ReceiverLinkOptions.RCV_SECOND);
        } else {
            options.setSndSettleMode(ReceiverLinkOptions.SND_SETTLED)
                    .setRcvSettleMode(ReceiverLinkOptions.RCV_FIRST);
        }
        return options;
    }

    @Override
    protected CompletableFuture<ReceiverLink> openLink(int generation) {
        ReceiverLinkOptions options = createReceiverOptions();
        log.debug("[{}] Creating receiver with {}", connectionId(), options);
        return connectionContext.getConnection().createReceiver(options, new ReceiverEventsAdapter(generation));
    }

    @Override
    protected void onLinkOpened(ReceiverLink openedLink) {
        onReceiverOpened(openedLink);
        if (!context.registerReceiver(this)) {
            log.debug("[{}] Receiver '{}' is open but not registered in the entity context", connectionId(), getName());
        }
    }

    /**
     * The receiver link is open. Subclasses grant their credit here.
     */
    protected void onReceiverOpened(ReceiverLink openedLink) {
    }

    /**
     * A message arrived on the current link. Called on the event loop.
     */
    protected abstract void onAmqpMessage(ReceivedMessage message, int generation);

    @Override
    protected void onClosing() {
        BatchCollector batch = pendingBatch;
        if (batch != null) {
            log.debug("[{}] Receiver '{}' closing, resolving the pending batch with {} messages",
                    connectionId(), getName(), batch.size());
            batch.finish();
        }
        for (LockRenewalTask renewal : new ArrayList<>(lockRenewals.values())) {
            renewal.cancel();
        }
        lockRenewals.clear();
        abandonPendingSettlements(MessagingErrorCode.CLIENT_ERROR, "was closed");
        context.deregisterReceiver(this);
    }

    @Override
    protected void onDetached(MessagingException error) {
        // Delivery ids restart on the next link, so its acknowledgements cannot match these
        abandonPendingSettlements(MessagingErrorCode.SERVICE_COMMUNICATION_ERROR, "was detached");
    }

    private void abandonPendingSettlements(MessagingErrorCode code, String reason) {
        List<PendingSettlement> pending = new ArrayList<>(deliveryDispositionMap.values());
        for (PendingSettlement settlement : pending) {
            if (deliveryDispositionMap.remove(settlement.getDeliveryId(), settlement)) {
                settlement.cancelTimeout();
                settlement.getFuture().completeExceptionally(new MessagingException(code,
                        "Receiver '" + getName() + "' " + reason + " before the settlement of delivery "
                                + settlement.getDeliveryId() + " was acknowledged."));
                emit(event(EventType.SETTLEMENT_ABANDONED).detail("deliveryId", settlement.getDeliveryId()));
            }
        }
    }

    @Override
    protected void notifyError(MessagingException error) {
        ErrorHandler handler = onError;
        if (handler == null) {
            log.warn("[{}] No error handler on receiver '{}', dropping error: {}",
                    connectionId(), getName(), error.toString());
            return;
        }
        deliverError(handler, error);
    }

    protected void deliverError(ErrorHandler handler, Throwable error) {
        try {
            handler.onError(error);
        } catch (RuntimeException e) {
            log.error("[{}] Error handler of receiver '{}' threw", connectionId(), getName(), e);
        }
    }

    private void onMessageEvent(int generation, IncomingDelivery delivery, AmqpMessage amqpMessage) {
        if (isStale(generation)) {
            log.debug("[{}] Dropping delivery {} of a replaced link of '{}'", connectionId(), delivery.getId(), getName());
            return;
        }
        if (getState() == LinkState.CLOSED) {
            log.debug("[{}] Receiver '{}' is closed, dropping delivery {}", connectionId(), getName(), delivery.getId());
            return;
        }
        ReceivedMessage message = ReceivedMessage.fromDelivery(amqpMessage, delivery, this, context, receiveMode);
        log.trace("[{}] Receiver '{}' received {}", connectionId(), getName(), message);
        emit(event(EventType.MESSAGE_RECEIVED)
                .detail("deliveryId", delivery.getId())
                .detail("messageId", message.getMessageId()));
        onAmqpMessage(message, generation);
    }

    /**
     * Run the handler on a message. The lock is renewed while the handler runs;
     * afterwards renewal is stopped before any settlement is attempted. On success
     * the message is completed when auto-complete is on; on failure the error is
     * reported and, unless the lock was lost, the message is abandoned.
     *
     * @return a future that completes, never exceptionally, once processing and settlement finished
     */
    protected CompletableFuture<Void> processWithHandler(ReceivedMessage message, MessageHandler handler) {
        LockRenewalTask renewal = startLockRenewal(message);
        CompletableFuture<Void> handled;
        try {
            handled = handler.onMessage(message);
            if (handled == null) {
                handled = CompletableFuture.completedFuture(null);
            }
        } catch (RuntimeException e) {
            handled = CompletableFuture.failedFuture(e);
        }
        CompletableFuture<Void> done = new CompletableFuture<>();
        handled.whenComplete((v, error) -> eventLoop.execute(() -> {
            stopLockRenewal(message, renewal);
            CompletableFuture<Void> settlement = error == null
                    ? afterHandlerSuccess(message)
                    : afterHandlerFailure(message, ErrorTranslator.unwrap(error));
            settlement.whenComplete((x, e) -> done.complete(null));
        }));
        return done;
    }

    private CompletableFuture<Void> afterHandlerSuccess(ReceivedMessage message) {
        if (!autoComplete || receiveMode != ReceiveMode.PEEK_LOCK || message.isSettlementRequested()) {
            return CompletableFuture.completedFuture(null);
        }
        log.debug("[{}] Auto-completing message '{}' on '{}'", connectionId(), message.getMessageId(), getName());
        return eventLoop.relay(message.complete()).handle((v, e) -> {
            if (e != null) {
                MessagingException translated = ErrorTranslator.translate(e);
                log.error("[{}] Auto-complete of message '{}' failed: {}",
                        connectionId(), message.getMessageId(), translated.toString());
                notifyError(translated);
            }
            return null;
        });
    }

    private CompletableFuture<Void> afterHandlerFailure(ReceivedMessage message, Throwable error) {
        MessagingException translated = ErrorTranslator.translate(error);
        log.error("[{}] Handler of '{}' failed on message '{}': {}",
                connectionId(), getName(), message.getMessageId(), translated.toString());
        ErrorHandler handler = onError;
        if (handler != null) {
            deliverError(handler, error);
        }
        if (receiveMode != ReceiveMode.PEEK_LOCK || translated.isLockLost() || message.isSettlementRequested()) {
            return CompletableFuture.completedFuture(null);
        }
        log.debug("[{}] Abandoning message '{}' after handler failure", connectionId(), message.getMessageId());
        return eventLoop.relay(message.abandon()).handle((v, e) -> {
            if (e != null) {
                MessagingException abandonError = ErrorTranslator.translate(e);
                log.error("[{}] Abandon of message '{}' failed: {}",
                        connectionId(), message.getMessageId(), abandonError.toString());
                notifyError(abandonError);
            }
            return null;
        });
    }

    private LockRenewalTask startLockRenewal(ReceivedMessage message) {
        if (!isAutoRenewLock() || message.getLockToken() == null || message.getLockedUntil() == null) {
            return null;
        }
        LockRenewalTask renewal = new LockRenewalTask(eventLoop,
                "message '" + message.getMessageId() + "' on '" + getName() + "'",
                eventLoop.now().plus(maxAutoRenewDuration),
                message::getLockedUntil,
                () -> context.getManagementClient().renewLock(message.getLockToken()),
                until -> {
                    message.setLockedUntil(until);
                    emit(event(EventType.LOCK_RENEWED)
                            .detail("messageId", message.getMessageId())
                            .detail("lockedUntil", until));
                },
                error -> {
                    lockRenewals.remove(message);
                    emit(event(EventType.LOCK_RENEWAL_FAILED)
                            .detail("messageId", message.getMessageId())
                            .detail("error", error.getCode()));
                    notifyError(error);
                });
        lockRenewals.put(message, renewal);
        renewal.start();
        return renewal;
    }

    private void stopLockRenewal(ReceivedMessage message, LockRenewalTask renewal) {
        if (renewal != null) {
            renewal.cancel();
            lockRenewals.remove(message, renewal);
        }
    }

    /**
     * Settle a delivery by operation name: complete, abandon, defer or deadletter.
     */
    public CompletableFuture<Void> settleMessage(IncomingDelivery delivery, String operation,
                                                 DispositionOptions options) {
        DispositionType type;
        try {
            type = DispositionType.fromOperation(operation);
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(e);
        }
        return settleMessage(delivery, type, options);
    }

    /**
     * Write the disposition of {@code type} for a delivery and wait for the peer
     * to acknowledge it. A second call for the same delivery with the same type
     * waits for the same acknowledgement; one with another type fails.
     */
    public CompletableFuture<Void> settleMessage(IncomingDelivery delivery, DispositionType type,
                                                 DispositionOptions options) {
        Objects.requireNonNull(delivery, "delivery");
        if (type == null) {
            return CompletableFuture.failedFuture(
                    new IllegalArgumentException("operation: 'null' is not a valid operation."));
        }
        DispositionOptions dispositionOptions = options != null ? options : new DispositionOptions();
        return eventLoop.submit(() -> {
            long deliveryId = delivery.getId();
            PendingSettlement existing = deliveryDispositionMap.get(deliveryId);
            if (existing != null) {
                if (existing.getType() == type) {
                    log.debug("[{}] Delivery {} already has a pending '{}', waiting for it",
                            connectionId(), deliveryId, type.operation());
                    return existing.getFuture();
                }
                return CompletableFuture.failedFuture(new IllegalStateException(
                        "Delivery " + deliveryId + " already has a pending '" + existing.getType().operation()
                                + "', cannot '" + type.operation() + "' it."));
            }
            if (!isOpen()) {
                return CompletableFuture.failedFuture(new MessagingException(MessagingErrorCode.ILLEGAL_STATE,
                        "Cannot '" + type.operation() + "' delivery " + deliveryId + ": receiver '" + getName()
                                + "' is " + getState() + "."));
            }
            PendingSettlement pending = new PendingSettlement(deliveryId, type);
            deliveryDispositionMap.put(deliveryId, pending);
            pending.setTimeout(eventLoop.schedule(() -> onSettlementTimeout(pending), DISPOSITION_TIMEOUT));
            try {
                writeDisposition(delivery, type, dispositionOptions);
            } catch (RuntimeException e) {
                deliveryDispositionMap.remove(deliveryId, pending);
                pending.cancelTimeout();
                MessagingException translated = ErrorTranslator.translate(e);
                log.error("[{}] Writing '{}' for delivery {} failed: {}",
                        connectionId(), type.operation(), deliveryId, translated.toString());
                pending.getFuture().completeExceptionally(translated);
                return pending.getFuture();
            }
            log.debug("[{}] Sent '{}' for delivery {} on '{}'", connectionId(), type.operation(), deliveryId, getName());
            emit(event(EventType.SETTLEMENT_SENT)
                    .detail("deliveryId", deliveryId)
                    .detail("operation", type.operation()));
            return pending.getFuture();
        });
    }

    private void writeDisposition(IncomingDelivery delivery, DispositionType type, DispositionOptions options) {
        switch (type) {
            case COMPLETE:
                delivery.accept();
                break;
            case ABANDON:
                delivery.modified(new Modified()
                        .setUndeliverableHere(false)
                        .setMessageAnnotations(options.getPropertiesToModify()));
                break;
            case DEFER:
                delivery.modified(new Modified()
                        .setUndeliverableHere(true)
                        .setMessageAnnotations(options.getPropertiesToModify()));
                break;
            case DEADLETTER:
                ErrorCondition error = options.getError() != null
                        ? options.getError() : new ErrorCondition(ErrorCondition.DEAD_LETTER);
                delivery.reject(new Rejected(error));
                break;
            default:
                throw new IllegalArgumentException("Unknown disposition: " + type);
        }
    }

    private void onSettlementTimeout(PendingSettlement pending) {
        if (deliveryDispositionMap.remove(pending.getDeliveryId(), pending)) {
            log.warn("[{}] No acknowledgement for '{}' of delivery {} on '{}' within {} s, assuming success",
                    connectionId(), pending.getType().operation(), pending.getDeliveryId(), getName(),
                    DISPOSITION_TIMEOUT.getSeconds());
            emit(event(EventType.SETTLEMENT_TIMED_OUT).detail("deliveryId", pending.getDeliveryId()));
            pending.getFuture().complete(null);
        }
    }

    private void onSettledEvent(int generation, long deliveryId, boolean remoteSettled, DeliveryState remoteState) {
        if (isStale(generation) || !remoteSettled) {
            return;
        }
        PendingSettlement pending = deliveryDispositionMap.remove(deliveryId);
        if (pending == null) {
            log.debug("[{}] Settlement of delivery {} on '{}' was not awaited", connectionId(), deliveryId, getName());
            return;
        }
        pending.cancelTimeout();
        ErrorCondition error = remoteState != null ? remoteState.getError() : null;
        // The peer may echo the rejected outcome of a dead-lettering back
        if (error != null && pending.getType() == DispositionType.DEADLETTER
                && ErrorCondition.DEAD_LETTER.equals(error.getCondition())) {
            error = null;
        }
        if (error != null) {
            MessagingException translated = ErrorTranslator.translate(error);
            log.error("[{}] Peer rejected '{}' of delivery {}: {}",
                    connectionId(), pending.getType().operation(), deliveryId, translated.toString());
            emit(event(EventType.SETTLEMENT_REJECTED)
                    .detail("deliveryId", deliveryId)
                    .detail("error", translated.getCode()));
            pending.getFuture().completeExceptionally(translated);
            return;
        }
        log.debug("[{}] Peer acknowledged '{}' of delivery {}", connectionId(), pending.getType().operation(), deliveryId);
        emit(event(EventType.SETTLEMENT_ACKNOWLEDGED).detail("deliveryId", deliveryId));
        pending.getFuture().complete(null);
    }

    /**
     * Request up to {@code maxMessageCount} messages. Only one batch may be pending at a time.
     */
    protected CompletableFuture<List<ReceivedMessage>> requestBatch(int maxMessageCount, Duration maxWaitTime) {
        if (maxMessageCount < 1) {
            return CompletableFuture.failedFuture(
                    new IllegalArgumentException("maxMessageCount must be at least 1: " + maxMessageCount));
        }
        Duration wait = maxWaitTime != null ? maxWaitTime : config.getBatchMaxWaitTime();
        return eventLoop.submit(() -> {
            if (pendingBatch != null) {
                return CompletableFuture.failedFuture(new IllegalStateException(
                        "Receiver '" + getName() + "' is already receiving a batch of messages."));
            }
            BatchCollector batch = new BatchCollector(eventLoop, maxMessageCount, wait,
                    config.getBatchIdleTimeout(), this::onBatchFinished);
            pendingBatch = batch;
            boolean open = isOpen();
            CompletableFuture<Void> ready = open ? CompletableFuture.completedFuture(null) : init();
            ready.whenComplete((v, e) -> {
                if (e != null) {
                    batch.fail(ErrorTranslator.translate(e));
                    return;
                }
                // A link opened by init() got its credit in onReceiverOpened
                if (open) {
                    grantPendingBatchCredit(getLink());
                }
                batch.start();
            });
            return batch.getFuture();
        });
    }

    protected boolean hasPendingBatch() {
        return pendingBatch != null;
    }

    /**
     * Grant the credit still missing for the pending batch, if any.
     */
    protected void grantPendingBatchCredit(ReceiverLink current) {
        BatchCollector batch = pendingBatch;
        if (batch == null || batch.isDone() || current == null || !current.isOpen()) {
            return;
        }
        log.debug("[{}] Granting {} credits to '{}' for the pending batch", connectionId(), batch.remaining(), getName());
        current.addCredit(batch.remaining());
    }

    /**
     * @return false if no batch is pending
     */
    protected boolean collectIntoBatch(ReceivedMessage message) {
        BatchCollector batch = pendingBatch;
        if (batch == null || batch.isDone()) {
            return false;
        }
        batch.add(message);
        return true;
    }

    /**
     * @return false if no batch is pending
     */
    protected boolean failPendingBatch(MessagingException error) {
        BatchCollector batch = pendingBatch;
        if (batch == null) {
            return false;
        }
        log.error("[{}] Failing the pending batch of '{}': {}", connectionId(), getName(), error.toString());
        batch.fail(error);
        return true;
    }

    private void onBatchFinished(BatchCollector batch) {
        if (pendingBatch == batch) {
            pendingBatch = null;
        }
        ReceiverLink current = getLink();
        if (current != null && current.isOpen() && current.getCredit() > 0) {
            log.debug("[{}] Draining {} unused credits of '{}'", connectionId(), current.getCredit(), getName());
            current.drain();
        }
        emit(event(EventType.BATCH_RESOLVED)
                .detail("messageCount", batch.size())
                .detail("failed", batch.getFuture().isCompletedExceptionally()));
    }

    /**
     * Grant one credit on the current link, in place of a processed message.
     */
    protected void replenishCredit(int generation) {
        ReceiverLink current = getLink();
        if (isStale(generation) || getState() != LinkState.OPEN || current == null || !current.isOpen()) {
            return;
        }
        current.addCredit(1);
    }

    /**
     * Hand a message nobody asked for back to the broker.
     */
    protected void releaseMessage(ReceivedMessage message) {
        if (receiveMode != ReceiveMode.PEEK_LOCK || message.getDelivery() == null) {
            return;
        }
        log.debug("[{}] No request pending on '{}', releasing message '{}'",
                connectionId(), getName(), message.getMessageId());
        message.getDelivery().release();
        emit(event(EventType.MESSAGE_RELEASED).detail("messageId", message.getMessageId()));
    }

    /**
     * Receiver link callbacks of one link generation, re-dispatched onto the event loop.
     */
    private class ReceiverEventsAdapter extends LinkEventsAdapter implements ReceiverEvents {

        ReceiverEventsAdapter(int linkGeneration) {
            super(linkGeneration);
        }

        @Override
        public void onMessage(IncomingDelivery delivery, AmqpMessage message) {
            eventLoop.execute(() -> onMessageEvent(linkGeneration, delivery, message));
        }

        @Override
        public void onSettled(long deliveryId, boolean remoteSettled, DeliveryState remoteState) {
            eventLoop.execute(() -> onSettledEvent(linkGeneration, deliveryId, remoteSettled, remoteState));
        }
    }
}
