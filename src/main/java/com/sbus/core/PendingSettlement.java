package com.sbus.core;

import com.sbus.util.ScheduledTask;

import java.util.concurrent.CompletableFuture;

/**
 * A disposition written for a delivery and not yet acknowledged by the peer.
 */
final class PendingSettlement {

    private final long deliveryId;
    private final DispositionType type;
    private final CompletableFuture<Void> future = new CompletableFuture<>();
    private ScheduledTask timeout;

    PendingSettlement(long deliveryId, DispositionType type) {
        this.deliveryId = deliveryId;
        this.type = type;
    }

    long getDeliveryId() {
        return deliveryId;
    }

    DispositionType getType() {
        return type;
    }

    CompletableFuture<Void> getFuture() {
        return future;
    }

    void setTimeout(ScheduledTask timeout) {
        this.timeout = timeout;
    }

    void cancelTimeout() {
        if (timeout != null) {
            timeout.cancel();
        }
    }
}
