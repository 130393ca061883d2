package com.sbus.protocol.v10.transport;

import java.util.Objects;

/**
 * Raised by the transport when an operation fails with an AMQP error condition,
 * for example when an attach is refused by the peer.
 */
public class AmqpErrorException extends RuntimeException {

    private final ErrorCondition error;

    public AmqpErrorException(ErrorCondition error) {
        super(Objects.requireNonNull(error, "error").getDescription() != null
                ? error.getCondition() + ": " + error.getDescription()
                : error.getCondition().toString());
        this.error = error;
    }

    public ErrorCondition getError() {
        return error;
    }
}
