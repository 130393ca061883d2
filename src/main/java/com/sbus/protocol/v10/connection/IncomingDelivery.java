package com.sbus.protocol.v10.connection;

import com.sbus.protocol.v10.delivery.Modified;
import com.sbus.protocol.v10.delivery.Rejected;

/**
 * A delivery received on a receiver link, with the disposition primitives the
 * transport offers for it. Each primitive writes one disposition frame.
 */
public interface IncomingDelivery {

    /**
     * Delivery id, unique among unsettled deliveries of the session.
     */
    long getId();

    byte[] getTag();

    /**
     * True when the sender sent the delivery pre-settled.
     */
    boolean isRemoteSettled();

    void accept();

    void modified(Modified modified);

    void reject(Rejected rejected);

    void release();
}
