package com.sbus.security;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Claims-based security negotiation performed before a link is opened and again
 * before the negotiated token expires.
 */
public interface ClaimNegotiator {

    /**
     * Put a token for {@code audience} on the connection so a link to {@code address} may be attached.
     *
     * @return the instant the negotiated token expires
     */
    CompletableFuture<Instant> negotiateClaim(String address, String audience);
}
