package com.sbus.protocol.v10.connection;

import com.sbus.protocol.v10.delivery.DeliveryState;
import com.sbus.protocol.v10.messaging.AmqpMessage;

/**
 * Callbacks of a receiver link.
 */
public interface ReceiverEvents extends LinkEvents {

    /**
     * A complete message arrived.
     */
    void onMessage(IncomingDelivery delivery, AmqpMessage message);

    /**
     * The peer sent a disposition for a delivery this side disposed of.
     *
     * @param deliveryId    delivery id the disposition refers to
     * @param remoteSettled whether the peer settled the delivery
     * @param remoteState   the peer's view of the outcome, possibly null
     */
    void onSettled(long deliveryId, boolean remoteSettled, DeliveryState remoteState);
}
