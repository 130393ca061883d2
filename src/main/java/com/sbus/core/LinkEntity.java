package com.sbus.core;

import com.sbus.config.ClientConfig;
import com.sbus.context.ClientEntityContext;
import com.sbus.context.ConnectionContext;
import com.sbus.errors.ErrorTranslator;
import com.sbus.errors.MessagingException;
import com.sbus.events.EntityEvent;
import com.sbus.events.EntityEvent.EventType;
import com.sbus.protocol.v10.connection.AmqpLink;
import com.sbus.protocol.v10.connection.LinkEvents;
import com.sbus.protocol.v10.connection.LinkState;
import com.sbus.protocol.v10.transport.AmqpErrorException;
import com.sbus.protocol.v10.transport.ErrorCondition;
import com.sbus.retry.Retry;
import com.sbus.retry.RetryConfig;
import com.sbus.retry.RetryOperationType;
import com.sbus.util.EventLoop;
import com.sbus.util.Names;
import com.sbus.util.ScheduledTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Lifecycle of one AMQP link to a broker entity.
 *
 * <p>State transitions:
 * <pre>
 * CLOSED -> CONNECTING -> OPEN        init() succeeded
 * CONNECTING -> CLOSED                init() failed
 * OPEN -> DETACHED                    the peer closed the link or its session
 * DETACHED -> CONNECTING -> OPEN      a reconnect attempt succeeded
 * CONNECTING -> DETACHED              a reconnect attempt failed, another may follow
 * DETACHED -> CLOSED                  not recoverable, or reconnect attempts exhausted
 * any -> CLOSED                       close()
 * </pre>
 *
 * <p>All state is read and written on the event loop. At most one establishment is
 * in flight: while CONNECTING or DETACHED, further detach triggers are ignored.
 * Callbacks of a link that has been replaced are recognised by their generation
 * and dropped.
 */
public abstract class LinkEntity<L extends AmqpLink> {

    private static final Logger log = LoggerFactory.getLogger(LinkEntity.class);

    protected final ClientEntityContext context;
    protected final ConnectionContext connectionContext;
    protected final EventLoop eventLoop;
    protected final ClientConfig config;

    private final String namePrefix;
    private final String address;
    private final String audience;

    private volatile String name;
    private volatile L link;
    private volatile LinkState state = LinkState.CLOSED;
    private int generation;
    private ScheduledTask tokenRenewalTask;

    protected LinkEntity(String name, ClientEntityContext context, String address, String audience) {
        this.context = Objects.requireNonNull(context, "context");
        this.connectionContext = context.getConnectionContext();
        this.eventLoop = context.getEventLoop();
        this.config = connectionContext.getConfig();
        this.namePrefix = context.getEntityPath();
        this.name = Objects.requireNonNull(name, "name");
        this.address = Objects.requireNonNull(address, "address");
        this.audience = Objects.requireNonNull(audience, "audience");
    }

    public String getName() {
        return name;
    }

    public String getAddress() {
        return address;
    }

    public String getAudience() {
        return audience;
    }

    public LinkState getState() {
        return state;
    }

    public boolean isConnecting() {
        return state.isConnecting();
    }

    public boolean isOpen() {
        L current = link;
        return state == LinkState.OPEN && current != null && current.isOpen();
    }

    protected L getLink() {
        return link;
    }

    protected String connectionId() {
        return connectionContext.getConnectionId();
    }

    /**
     * Attach a new link under the current name. Called on the event loop.
     *
     * @param generation tag of the link being opened, passed to {@link LinkEventsAdapter}
     */
    protected abstract CompletableFuture<L> openLink(int generation);

    protected abstract RetryOperationType linkOperationType();

    /**
     * Report an error the application did not ask about.
     */
    protected abstract void notifyError(MessagingException error);

    /**
     * The link is open and installed. Called on the event loop.
     */
    protected void onLinkOpened(L openedLink) {
    }

    /**
     * The entity became CLOSED, by close() or because it could not be recovered. Called on the event loop.
     */
    protected void onClosing() {
    }

    /**
     * The current link went away and will be released. Called on the event loop
     * before any reopen is attempted.
     */
    protected void onDetached(MessagingException error) {
    }

    protected void onReconnectFailed(MessagingException error) {
        notifyError(error);
    }

    /**
     * Open the link. Completes at once if the entity is not CLOSED: it is open or
     * someone else is already establishing it.
     */
    public CompletableFuture<Void> init() {
        return eventLoop.submit(() -> {
            if (state != LinkState.CLOSED) {
                log.debug("[{}] '{}' is {}, not initializing", connectionId(), name, state);
                return CompletableFuture.completedFuture(null);
            }
            return establish(LinkState.CLOSED);
        });
    }

    private CompletableFuture<Void> reopen() {
        return eventLoop.submit(() -> {
            if (state != LinkState.DETACHED) {
                log.debug("[{}] '{}' is {}, abandoning the reconnect attempt", connectionId(), name, state);
                return CompletableFuture.completedFuture(null);
            }
            return establish(LinkState.DETACHED);
        });
    }

    private CompletableFuture<Void> establish(LinkState onFailure) {
        setState(LinkState.CONNECTING);
        int linkGeneration = ++generation;
        String linkName = name;
        CompletableFuture<Void> result = new CompletableFuture<>();
        log.debug("[{}] Negotiating claim for '{}' with audience '{}'", connectionId(), linkName, audience);
        eventLoop.relay(negotiateClaim())
                .thenCompose(expiry -> {
                    log.debug("[{}] Attaching link '{}' to '{}'", connectionId(), linkName, address);
                    return eventLoop.relay(openLink(linkGeneration))
                            .thenApply(opened -> new Established<>(opened, expiry));
                })
                .whenComplete((established, error) -> {
                    if (error != null) {
                        MessagingException translated = ErrorTranslator.translate(error);
                        if (state == LinkState.CONNECTING) {
                            setState(onFailure);
                        }
                        log.error("[{}] Failed to open link '{}' to '{}': {}",
                                connectionId(), linkName, address, translated.toString());
                        emit(event(EventType.LINK_OPEN_FAILED).detail("error", translated.getCode()));
                        result.completeExceptionally(translated);
                        return;
                    }
                    if (state != LinkState.CONNECTING || linkGeneration != generation) {
                        log.debug("[{}] '{}' became {} while attaching, closing the new link",
                                connectionId(), linkName, state);
                        closeQuietly(established.link);
                        result.complete(null);
                        return;
                    }
                    link = established.link;
                    setState(LinkState.OPEN);
                    log.info("[{}] Link '{}' to '{}' is open", connectionId(), linkName, address);
                    emit(event(EventType.LINK_OPENED));
                    scheduleTokenRenewal(established.tokenExpiry);
                    onLinkOpened(established.link);
                    result.complete(null);
                });
        return result;
    }

    protected CompletableFuture<Instant> negotiateClaim() {
        try {
            return connectionContext.getClaimNegotiator().negotiateClaim(address, audience);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private void scheduleTokenRenewal(Instant expiry) {
        cancelTokenRenewal();
        if (expiry == null) {
            return;
        }
        Duration margin = config.getTokenRenewalMargin();
        Duration remaining = Duration.between(eventLoop.now(), expiry);
        Duration delay = remaining.minus(margin);
        if (delay.isNegative() || delay.isZero()) {
            delay = remaining.dividedBy(2);
        }
        if (delay.compareTo(Duration.ofSeconds(1)) < 0) {
            delay = Duration.ofSeconds(1);
        }
        tokenRenewalTask = eventLoop.schedule(this::renewToken, delay);
    }

    private void renewToken() {
        tokenRenewalTask = null;
        if (state != LinkState.OPEN) {
            return;
        }
        eventLoop.relay(negotiateClaim()).whenComplete((expiry, error) -> {
            if (state != LinkState.OPEN) {
                return;
            }
            if (error != null) {
                log.warn("[{}] Token renewal for '{}' failed, retrying in {} s: {}", connectionId(), name,
                        config.getTokenRenewalMargin().getSeconds(), ErrorTranslator.translate(error).toString());
                cancelTokenRenewal();
                tokenRenewalTask = eventLoop.schedule(this::renewToken, config.getTokenRenewalMargin());
                return;
            }
            log.debug("[{}] Renewed token for '{}' until {}", connectionId(), name, expiry);
            emit(event(EventType.TOKEN_RENEWED).detail("expiresAt", expiry));
            scheduleTokenRenewal(expiry);
        });
    }

    private void cancelTokenRenewal() {
        if (tokenRenewalTask != null) {
            tokenRenewalTask.cancel();
            tokenRenewalTask = null;
        }
    }

    /**
     * The link or its session went away. Unless the close was our own or the error
     * is not retryable, the link is reopened under a new name by the retry
     * orchestrator. The returned future completes when recovery ended, either way.
     */
    public CompletableFuture<Void> detached(Throwable error) {
        return eventLoop.submit(() -> {
            if (state == LinkState.CLOSED) {
                log.debug("[{}] '{}' is closed, not reconnecting", connectionId(), name);
                return CompletableFuture.completedFuture(null);
            }
            if (state.isConnecting()) {
                log.debug("[{}] '{}' is already {}, ignoring the detach", connectionId(), name, state);
                return CompletableFuture.completedFuture(null);
            }
            L current = link;
            boolean wasCloseInitiated = current != null && current.isClosedLocally();
            MessagingException translated = error == null ? null : ErrorTranslator.translate(error);
            setState(LinkState.DETACHED);
            emit(event(EventType.LINK_DETACHED)
                    .detail("error", translated != null ? translated.getCode() : null)
                    .detail("closeInitiated", wasCloseInitiated));
            onDetached(translated);
            return releaseLink(current).thenCompose(v -> afterRelease(wasCloseInitiated, translated));
        });
    }

    private CompletableFuture<Void> afterRelease(boolean wasCloseInitiated, MessagingException error) {
        boolean shouldReopen;
        if (wasCloseInitiated) {
            log.info("[{}] Link '{}' was closed by this client, not reopening", connectionId(), name);
            shouldReopen = false;
        } else if (error != null) {
            shouldReopen = error.isRetryable();
            log.info("[{}] Link '{}' detached with {} error {}, {}", connectionId(), name,
                    shouldReopen ? "retryable" : "non-retryable", error.getCode(),
                    shouldReopen ? "reopening" : "not reopening");
        } else {
            log.info("[{}] Link '{}' detached without an error, reopening", connectionId(), name);
            shouldReopen = true;
        }
        if (state != LinkState.DETACHED) {
            return CompletableFuture.completedFuture(null);
        }
        if (!shouldReopen) {
            // A non-retryable error was already reported by the error event that preceded the close
            setState(LinkState.CLOSED);
            onClosing();
            return CompletableFuture.completedFuture(null);
        }
        String previous = name;
        name = Names.uniqueName(namePrefix);
        log.debug("[{}] Reopening '{}' as '{}'", connectionId(), previous, name);
        emit(event(EventType.RECONNECT_STARTED).detail("previousName", previous));
        RetryConfig<Void> retryConfig = new RetryConfig<>(this::reopen, connectionId(), linkOperationType())
                .setTimes(config.getReconnectAttempts())
                .setDelay(config.getReconnectDelay());
        return Retry.retry(retryConfig, eventLoop).handle((v, e) -> {
            if (e != null) {
                MessagingException translated = ErrorTranslator.translate(e);
                if (state == LinkState.DETACHED || state == LinkState.CONNECTING) {
                    setState(LinkState.CLOSED);
                    onClosing();
                }
                log.error("[{}] Giving up reopening '{}': {}", connectionId(), name, translated.toString());
                emit(event(EventType.RECONNECT_EXHAUSTED).detail("error", translated.getCode()));
                onReconnectFailed(translated);
            }
            return null;
        });
    }

    /**
     * Close the entity. It will not be reopened afterwards.
     */
    public CompletableFuture<Void> close() {
        return eventLoop.submit(() -> {
            if (state == LinkState.CLOSED && link == null) {
                return CompletableFuture.completedFuture(null);
            }
            log.debug("[{}] Closing '{}'", connectionId(), name);
            setState(LinkState.CLOSED);
            onClosing();
            return releaseLink(link).thenRun(() -> {
                log.info("[{}] Link '{}' closed", connectionId(), name);
                emit(event(EventType.LINK_CLOSED));
            });
        });
    }

    private CompletableFuture<Void> releaseLink(L current) {
        cancelTokenRenewal();
        link = null;
        if (current == null) {
            return CompletableFuture.completedFuture(null);
        }
        CompletableFuture<Void> closing;
        try {
            closing = current.close();
        } catch (RuntimeException e) {
            closing = CompletableFuture.failedFuture(e);
        }
        return eventLoop.relay(closing).exceptionally(e -> {
            log.warn("[{}] Error closing link '{}': {}", connectionId(), current.getName(),
                    ErrorTranslator.translate(e).toString());
            return null;
        });
    }

    private void closeQuietly(L stray) {
        stray.close().whenComplete((v, e) -> {
            if (e != null) {
                log.debug("[{}] Error closing stray link '{}': {}", connectionId(), stray.getName(), e.toString());
            }
        });
    }

    private void setState(LinkState newState) {
        LinkState oldState = state;
        state = newState;
        log.debug("[{}] '{}' state: {} -> {}", connectionId(), name, oldState, newState);
    }

    protected boolean isStale(int linkGeneration) {
        return linkGeneration != generation;
    }

    // Transport events, already on the event loop

    private void onLinkErrorEvent(int linkGeneration, ErrorCondition error) {
        if (isStale(linkGeneration) || error == null) {
            return;
        }
        L current = link;
        onErrorEvent(error, "link", current != null && current.isClosedLocally());
    }

    private void onSessionErrorEvent(int linkGeneration, ErrorCondition error) {
        if (isStale(linkGeneration) || error == null) {
            return;
        }
        L current = link;
        onErrorEvent(error, "session", current != null && current.isSessionClosedLocally());
    }

    private void onErrorEvent(ErrorCondition error, String what, boolean closedLocally) {
        MessagingException translated = ErrorTranslator.translate(error);
        log.error("[{}] An error occurred on the {} of '{}': {}", connectionId(), what, name, translated.toString());
        if (translated.isRetryable()) {
            log.debug("[{}] Error on '{}' is retryable, the reopen will handle it", connectionId(), name);
            return;
        }
        if (closedLocally || state == LinkState.CLOSED) {
            log.debug("[{}] '{}' was closed by this client, not reporting the error", connectionId(), name);
            return;
        }
        notifyError(translated);
    }

    private void onLinkCloseEvent(int linkGeneration, ErrorCondition error) {
        if (isStale(linkGeneration)) {
            return;
        }
        L current = link;
        onCloseEvent(error, "link", current == null || current.isClosedLocally());
    }

    private void onSessionCloseEvent(int linkGeneration, ErrorCondition error) {
        if (isStale(linkGeneration)) {
            return;
        }
        L current = link;
        onCloseEvent(error, "session", current == null || current.isSessionClosedLocally());
    }

    private void onCloseEvent(ErrorCondition error, String what, boolean closedLocally) {
        if (closedLocally || state == LinkState.CLOSED) {
            log.debug("[{}] The {} of '{}' was closed by this client", connectionId(), what, name);
            return;
        }
        if (state.isConnecting()) {
            log.debug("[{}] The {} of '{}' closed while reconnecting, ignoring", connectionId(), what, name);
            return;
        }
        log.warn("[{}] The {} of '{}' was closed by the peer: {}", connectionId(), what, name, error);
        detached(error == null ? null : new AmqpErrorException(error));
    }

    protected EntityEvent.Builder event(EventType type) {
        return EntityEvent.builder(type)
                .timestamp(eventLoop.now())
                .connectionId(connectionId())
                .entity(name, address);
    }

    protected void emit(EntityEvent.Builder event) {
        connectionContext.emit(event.build());
    }

    /**
     * Link callbacks of one link generation, re-dispatched onto the event loop.
     */
    protected class LinkEventsAdapter implements LinkEvents {

        protected final int linkGeneration;

        protected LinkEventsAdapter(int linkGeneration) {
            this.linkGeneration = linkGeneration;
        }

        @Override
        public void onLinkError(ErrorCondition error) {
            eventLoop.execute(() -> onLinkErrorEvent(linkGeneration, error));
        }

        @Override
        public void onLinkClose(ErrorCondition error) {
            eventLoop.execute(() -> onLinkCloseEvent(linkGeneration, error));
        }

        @Override
        public void onSessionError(ErrorCondition error) {
            eventLoop.execute(() -> onSessionErrorEvent(linkGeneration, error));
        }

        @Override
        public void onSessionClose(ErrorCondition error) {
            eventLoop.execute(() -> onSessionCloseEvent(linkGeneration, error));
        }
    }

    private static final class Established<L> {
        final L link;
        final Instant tokenExpiry;

        Established(L link, Instant tokenExpiry) {
            this.link = link;
            this.tokenExpiry = tokenExpiry;
        }
    }
}
