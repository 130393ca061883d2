package com.sbus.session;

import com.sbus.context.ClientEntityContext;
import com.sbus.core.ErrorHandler;
import com.sbus.core.LockRenewalTask;
import com.sbus.core.MessageHandler;
import com.sbus.core.MessageHandlerOptions;
import com.sbus.core.MessageReceiver;
import com.sbus.core.ReceiveOptions;
import com.sbus.core.ReceiverKind;
import com.sbus.errors.ErrorTranslator;
import com.sbus.errors.MessagingException;
import com.sbus.events.EntityEvent.EventType;
import com.sbus.model.ReceivedMessage;
import com.sbus.protocol.v10.connection.ReceiverLink;
import com.sbus.protocol.v10.connection.ReceiverLinkOptions;
import com.sbus.protocol.v10.types.Symbol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Receiver bound to one message session. The session is locked to this receiver
 * when the link attaches; the lock is renewed automatically. Messages are either
 * pushed to a handler or received in batches, never both at once.
 */
public class MessageSession extends MessageReceiver {

    private static final Logger log = LoggerFactory.getLogger(MessageSession.class);

    public static final Symbol SESSION_FILTER = Symbol.valueOf("com.microsoft:session-filter");
    public static final Symbol LOCKED_UNTIL_UTC = Symbol.valueOf("com.microsoft:locked-until-utc");

    // .NET ticks at the Unix epoch
    private static final long EPOCH_TICKS = 621_355_968_000_000_000L;
    private static final long TICKS_PER_MILLI = 10_000L;

    private final Duration maxSessionAutoRenewDuration;
    private volatile String sessionId;
    private volatile Instant sessionLockedUntil;
    private Instant sessionRenewalDeadline;
    private LockRenewalTask sessionLockRenewal;
    private volatile MessageHandler onMessage;

    public MessageSession(ClientEntityContext context, SessionReceiverOptions options) {
        super(context, ReceiverKind.SESSION, new ReceiveOptions().setReceiveMode(options.getReceiveMode()));
        this.sessionId = options.getSessionId();
        this.maxSessionAutoRenewDuration = options.getMaxSessionAutoRenewLockDuration() != null
                ? options.getMaxSessionAutoRenewLockDuration() : config.getMaxSessionAutoRenewDuration();
    }

    /**
     * Attach to the session. A failure is final for this session receiver and is not retried.
     */
    public CompletableFuture<MessageSession> accept() {
        return init().thenApply(v -> {
            if (!isOpen()) {
                throw new IllegalStateException("Session receiver '" + getName() + "' is " + getState() + ".");
            }
            return this;
        });
    }

    public String getSessionId() {
        return sessionId;
    }

    public Instant getSessionLockedUntil() {
        return sessionLockedUntil;
    }

    public boolean isSessionLockRenewing() {
        return sessionLockRenewal != null && sessionLockRenewal.isActive();
    }

    @Override
    protected ReceiverLinkOptions createReceiverOptions() {
        return super.createReceiverOptions().addSourceFilter(SESSION_FILTER, sessionId);
    }

    @Override
    protected void onReceiverOpened(ReceiverLink openedLink) {
        Map<Symbol, Object> filter = openedLink.getRemoteSourceFilter();
        Object acceptedId = filter != null ? filter.get(SESSION_FILTER) : null;
        if (acceptedId != null) {
            sessionId = acceptedId.toString();
        }
        Map<Symbol, Object> properties = openedLink.getRemoteProperties();
        Instant lockedUntil = properties != null ? toInstant(properties.get(LOCKED_UNTIL_UTC)) : null;
        if (lockedUntil != null) {
            sessionLockedUntil = lockedUntil;
        }
        log.info("[{}] Accepted session '{}' on '{}', locked until {}",
                connectionId(), sessionId, getName(), sessionLockedUntil);
        emit(event(EventType.SESSION_ACCEPTED)
                .detail("sessionId", sessionId)
                .detail("lockedUntil", sessionLockedUntil));
        startSessionLockRenewal();
        if (onMessage != null) {
            openedLink.addCredit(maxConcurrentCalls);
        } else {
            grantPendingBatchCredit(openedLink);
        }
    }

    private void startSessionLockRenewal() {
        if (sessionLockRenewal != null) {
            sessionLockRenewal.cancel();
            sessionLockRenewal = null;
        }
        if (maxSessionAutoRenewDuration.isZero() || sessionLockedUntil == null || sessionId == null) {
            return;
        }
        if (sessionRenewalDeadline == null) {
            sessionRenewalDeadline = eventLoop.now().plus(maxSessionAutoRenewDuration);
        }
        String id = sessionId;
        sessionLockRenewal = new LockRenewalTask(eventLoop, "session '" + id + "'", sessionRenewalDeadline,
                this::getSessionLockedUntil,
                () -> context.getManagementClient().renewSessionLock(id),
                until -> {
                    sessionLockedUntil = until;
                    emit(event(EventType.LOCK_RENEWED)
                            .detail("sessionId", id)
                            .detail("lockedUntil", until));
                },
                error -> {
                    emit(event(EventType.LOCK_RENEWAL_FAILED)
                            .detail("sessionId", id)
                            .detail("error", error.getCode()));
                    notifyError(error);
                });
        sessionLockRenewal.start();
    }

    /**
     * Push the messages of the session to {@code onMessage}.
     */
    public CompletableFuture<Void> receive(MessageHandler onMessage, ErrorHandler onError,
                                           MessageHandlerOptions options) {
        Objects.requireNonNull(onMessage, "onMessage");
        Objects.requireNonNull(onError, "onError");
        return eventLoop.submit(() -> {
            if (this.onMessage != null || hasPendingBatch()) {
                return CompletableFuture.failedFuture(new IllegalStateException(
                        "Session '" + sessionId + "' is already receiving messages."));
            }
            applyHandlerOptions(options);
            this.onMessage = onMessage;
            this.onError = onError;
            if (isOpen()) {
                getLink().addCredit(maxConcurrentCalls);
                return CompletableFuture.completedFuture(null);
            }
            return init().whenComplete((v, e) -> {
                if (e != null) {
                    this.onMessage = null;
                    deliverError(onError, ErrorTranslator.translate(e));
                }
            });
        });
    }

    /**
     * Receive up to {@code maxMessageCount} messages of the session.
     */
    public CompletableFuture<List<ReceivedMessage>> receiveBatch(int maxMessageCount, Duration maxWaitTime) {
        if (onMessage != null) {
            return CompletableFuture.failedFuture(new IllegalStateException(
                    "Session '" + sessionId + "' is receiving messages with a handler."));
        }
        return requestBatch(maxMessageCount, maxWaitTime);
    }

    @Override
    protected void onAmqpMessage(ReceivedMessage message, int generation) {
        MessageHandler handler = onMessage;
        if (handler != null) {
            processWithHandler(message, handler).thenRun(() -> replenishCredit(generation));
            return;
        }
        if (!collectIntoBatch(message)) {
            releaseMessage(message);
        }
    }

    @Override
    protected void notifyError(MessagingException error) {
        if (!failPendingBatch(error)) {
            super.notifyError(error);
        }
    }

    @Override
    protected void onClosing() {
        if (sessionLockRenewal != null) {
            sessionLockRenewal.cancel();
            sessionLockRenewal = null;
        }
        super.onClosing();
    }

    static Instant toInstant(Object value) {
        if (value instanceof Instant) {
            return (Instant) value;
        }
        if (value instanceof Date) {
            return ((Date) value).toInstant();
        }
        if (value instanceof Number) {
            long raw = ((Number) value).longValue();
            // Values this large are .NET ticks rather than epoch milliseconds
            if (raw > EPOCH_TICKS) {
                return Instant.ofEpochMilli((raw - EPOCH_TICKS) / TICKS_PER_MILLI);
            }
            return Instant.ofEpochMilli(raw);
        }
        return null;
    }
}
