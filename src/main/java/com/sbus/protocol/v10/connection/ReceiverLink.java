package com.sbus.protocol.v10.connection;

import com.sbus.protocol.v10.types.Symbol;

import java.util.Map;

/**
 * A receiving link. Credit is managed explicitly by the client.
 */
public interface ReceiverLink extends AmqpLink {

    /**
     * Issue additional link credit to the sender.
     */
    void addCredit(int credit);

    /**
     * Current link credit.
     */
    long getCredit();

    /**
     * Ask the sender to use up or discard all outstanding credit.
     */
    void drain();

    /**
     * Source filter set by the peer in its attach.
     */
    Map<Symbol, Object> getRemoteSourceFilter();

    /**
     * Link properties set by the peer in its attach.
     */
    Map<Symbol, Object> getRemoteProperties();
}
