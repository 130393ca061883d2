package com.sbus.client;

import com.sbus.core.StreamingReceiver;

import java.util.concurrent.CompletableFuture;

/**
 * Handle of a running streaming receive.
 */
public class ReceiveHandler {

    private final StreamingReceiver receiver;

    ReceiveHandler(StreamingReceiver receiver) {
        this.receiver = receiver;
    }

    public String getName() {
        return receiver.getName();
    }

    public boolean isReceiverOpen() {
        return receiver.isOpen();
    }

    /**
     * Stop receiving and close the receiver link.
     */
    public CompletableFuture<Void> stop() {
        return receiver.close();
    }
}
