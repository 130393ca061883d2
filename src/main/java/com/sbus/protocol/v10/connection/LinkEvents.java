package com.sbus.protocol.v10.connection;

import com.sbus.protocol.v10.transport.ErrorCondition;

/**
 * Callbacks a link registers with the transport when it is attached. The error is
 * null when the peer closed without one.
 */
public interface LinkEvents {

    void onLinkError(ErrorCondition error);

    void onLinkClose(ErrorCondition error);

    void onSessionError(ErrorCondition error);

    void onSessionClose(ErrorCondition error);
}
