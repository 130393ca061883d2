package com.sbus.protocol.v10.delivery;

/**
 * AMQP 1.0 Accepted delivery state.
 *
 * The outcome written when a peek-locked message is completed.
 */
public final class Accepted implements DeliveryState {

    // Singleton instance since Accepted has no fields
    public static final Accepted INSTANCE = new Accepted();

    private Accepted() {
    }

    @Override
    public long getDescriptor() {
        return ACCEPTED;
    }

    @Override
    public boolean isTerminal() {
        return true;
    }

    @Override
    public String toString() {
        return "Accepted{}";
    }
}
