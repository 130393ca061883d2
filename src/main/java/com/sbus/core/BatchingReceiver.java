package com.sbus.core;

import com.sbus.context.ClientEntityContext;
import com.sbus.errors.MessagingException;
import com.sbus.model.ReceivedMessage;
import com.sbus.protocol.v10.connection.ReceiverLink;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Receives messages on request, one batch at a time. Credit is granted for the
 * requested count and drained when the batch resolves; messages arriving with no
 * batch pending are released back to the broker.
 */
public class BatchingReceiver extends MessageReceiver {

    public BatchingReceiver(ClientEntityContext context, ReceiveOptions options) {
        super(context, ReceiverKind.BATCHING, options);
    }

    /**
     * Receive up to {@code maxMessageCount} messages, waiting at most
     * {@code maxWaitTime} (the configured default when null).
     */
    public CompletableFuture<List<ReceivedMessage>> receive(int maxMessageCount, Duration maxWaitTime) {
        return requestBatch(maxMessageCount, maxWaitTime);
    }

    public boolean isReceivingBatch() {
        return hasPendingBatch();
    }

    @Override
    protected void onReceiverOpened(ReceiverLink openedLink) {
        grantPendingBatchCredit(openedLink);
    }

    @Override
    protected void onAmqpMessage(ReceivedMessage message, int generation) {
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
}
