package com.sbus.protocol.v10.delivery;

import com.sbus.protocol.v10.transport.ErrorCondition;

/**
 * Base interface for AMQP 1.0 delivery states.
 *
 * A receiver writes one of these as the outcome of a disposition, and the peer
 * echoes its own view of the state back when it settles the delivery.
 */
public interface DeliveryState {

    long ACCEPTED = 0x24L;
    long REJECTED = 0x25L;
    long RELEASED = 0x26L;
    long MODIFIED = 0x27L;

    /**
     * Get the descriptor code for this delivery state.
     */
    long getDescriptor();

    /**
     * Check if this is a terminal state (delivery is complete).
     */
    boolean isTerminal();

    /**
     * Error carried by the state, if any. Only a rejected outcome carries one.
     */
    default ErrorCondition getError() {
        return null;
    }
}
