package com.sbus.protocol.v10.delivery;

/**
 * AMQP 1.0 Released delivery state.
 *
 * Hands a delivery back to the broker untouched so it can be redelivered at once,
 * used for messages that arrive when no batch is waiting for them.
 */
public final class Released implements DeliveryState {

    public static final Released INSTANCE = new Released();

    private Released() {
    }

    @Override
    public long getDescriptor() {
        return RELEASED;
    }

    @Override
    public boolean isTerminal() {
        return true;
    }

    @Override
    public String toString() {
        return "Released{}";
    }
}
