package com.sbus.protocol.v10.delivery;

import com.sbus.protocol.v10.transport.ErrorCondition;

/**
 * AMQP 1.0 Rejected delivery state.
 *
 * Written by dead-lettering, and echoed by the peer when it refuses a disposition
 * (for example because the lock has expired).
 *
 * Fields:
 * 0: error (error) - Error explaining the rejection
 */
public class Rejected implements DeliveryState {

    private ErrorCondition error;

    public Rejected() {
    }

    public Rejected(ErrorCondition error) {
        this.error = error;
    }

    @Override
    public long getDescriptor() {
        return REJECTED;
    }

    @Override
    public boolean isTerminal() {
        return true;
    }

    @Override
    public ErrorCondition getError() {
        return error;
    }

    public Rejected setError(ErrorCondition error) {
        this.error = error;
        return this;
    }

    @Override
    public String toString() {
        return "Rejected{error=" + error + "}";
    }
}
