package com.sbus.core;

import com.sbus.context.ClientEntityContext;
import com.sbus.errors.ErrorTranslator;
import com.sbus.model.ReceivedMessage;
import com.sbus.protocol.v10.connection.ReceiverLink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Pushes messages to an application handler as they arrive.
 *
 * Credit equal to the number of concurrent calls is granted when the link opens,
 * and one more credit whenever a message has been processed and settled, so at
 * most that many messages are in the handler at any time.
 */
public class StreamingReceiver extends MessageReceiver {

    private static final Logger log = LoggerFactory.getLogger(StreamingReceiver.class);

    private volatile MessageHandler onMessage;

    public StreamingReceiver(ClientEntityContext context, ReceiveOptions options) {
        super(context, ReceiverKind.STREAMING, options);
    }

    /**
     * Start delivering messages to {@code onMessage}. Errors that happen while
     * receiving, the failure to open the link included, go to {@code onError}.
     */
    public CompletableFuture<Void> receive(MessageHandler onMessage, ErrorHandler onError) {
        Objects.requireNonNull(onMessage, "onMessage");
        Objects.requireNonNull(onError, "onError");
        return eventLoop.submit(() -> {
            if (this.onMessage != null) {
                return CompletableFuture.failedFuture(new IllegalStateException(
                        "Receiver '" + getName() + "' is already receiving messages."));
            }
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

    public boolean isReceiving() {
        return onMessage != null && isOpen();
    }

    @Override
    protected void onReceiverOpened(ReceiverLink openedLink) {
        if (onMessage != null) {
            log.debug("[{}] Granting {} credits to '{}'", connectionId(), maxConcurrentCalls, getName());
            openedLink.addCredit(maxConcurrentCalls);
        }
    }

    @Override
    protected void onAmqpMessage(ReceivedMessage message, int generation) {
        MessageHandler handler = onMessage;
        if (handler == null) {
            releaseMessage(message);
            return;
        }
        processWithHandler(message, handler).thenRun(() -> replenishCredit(generation));
    }
}
