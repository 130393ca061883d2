package com.sbus.core;

import com.sbus.context.ClientEntityContext;
import com.sbus.errors.ErrorTranslator;
import com.sbus.errors.MessagingErrorCode;
import com.sbus.errors.MessagingException;
import com.sbus.model.OutgoingMessage;
import com.sbus.protocol.v10.connection.SenderLink;
import com.sbus.protocol.v10.connection.SenderLinkOptions;
import com.sbus.protocol.v10.delivery.DeliveryState;
import com.sbus.protocol.v10.messaging.AmqpMessage;
import com.sbus.protocol.v10.transport.ErrorCondition;
import com.sbus.retry.Retry;
import com.sbus.retry.RetryConfig;
import com.sbus.retry.RetryOperationType;
import com.sbus.util.Names;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Sender link entity. Each send is retried by the retry orchestrator and
 * succeeds only when the peer accepts the message.
 */
public class MessageSender extends LinkEntity<SenderLink> {

    private static final Logger log = LoggerFactory.getLogger(MessageSender.class);

    public MessageSender(ClientEntityContext context) {
        super(Names.uniqueName(context.getEntityPath()), context, context.getEntityPath(), context.getAudience());
    }

    public CompletableFuture<Void> send(OutgoingMessage message) {
        Objects.requireNonNull(message, "message");
        AmqpMessage amqpMessage = message.toAmqpMessage();
        RetryConfig<Void> retryConfig = new RetryConfig<>(() -> trySend(amqpMessage), connectionId(),
                RetryOperationType.SEND_MESSAGE)
                .setTimes(config.getOperationRetryAttempts())
                .setDelay(config.getOperationRetryDelay());
        return Retry.retry(retryConfig, eventLoop);
    }

    private CompletableFuture<Void> trySend(AmqpMessage message) {
        CompletableFuture<Void> ready = isOpen() ? CompletableFuture.completedFuture(null) : init();
        return ready.thenCompose(v -> {
            SenderLink current = getLink();
            if (current == null || !isOpen()) {
                return CompletableFuture.failedFuture(new MessagingException(
                        MessagingErrorCode.SERVICE_COMMUNICATION_ERROR,
                        "Sender '" + getName() + "' is " + getState() + ", cannot send."));
            }
            if (!current.isSendable()) {
                return CompletableFuture.failedFuture(new MessagingException(MessagingErrorCode.SERVER_BUSY,
                        "Sender '" + getName() + "' has no credit to send."));
            }
            log.trace("[{}] Sending {} on '{}'", connectionId(), message, getName());
            return eventLoop.relay(current.send(message)).thenCompose(this::checkOutcome);
        });
    }

    private CompletableFuture<Void> checkOutcome(DeliveryState outcome) {
        if (outcome == null || outcome.getDescriptor() == DeliveryState.ACCEPTED) {
            return CompletableFuture.completedFuture(null);
        }
        if (outcome.getDescriptor() == DeliveryState.REJECTED) {
            ErrorCondition error = outcome.getError() != null
                    ? outcome.getError() : new ErrorCondition(ErrorCondition.INTERNAL_ERROR, "Message was rejected.");
            return CompletableFuture.failedFuture(ErrorTranslator.translate(error));
        }
        return CompletableFuture.failedFuture(new MessagingException(MessagingErrorCode.MESSAGING_ERROR,
                "Message was not accepted by the peer: " + outcome));
    }

    @Override
    protected CompletableFuture<SenderLink> openLink(int generation) {
        SenderLinkOptions options = new SenderLinkOptions(getName(), getAddress());
        log.debug("[{}] Creating sender with {}", connectionId(), options);
        return connectionContext.getConnection().createSender(options, new LinkEventsAdapter(generation));
    }

    @Override
    protected RetryOperationType linkOperationType() {
        return RetryOperationType.SENDER_LINK;
    }

    @Override
    protected void onLinkOpened(SenderLink openedLink) {
        context.registerSender(this);
    }

    @Override
    protected void onClosing() {
        context.deregisterSender(this);
    }

    @Override
    protected void notifyError(MessagingException error) {
        // Send failures reach the caller through the send future
        log.error("[{}] Sender '{}' error: {}", connectionId(), getName(), error.toString());
    }
}
