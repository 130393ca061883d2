package com.sbus.core;

import com.sbus.model.ReceivedMessage;

import java.util.concurrent.CompletableFuture;

/**
 * Application callback invoked for every message a streaming receiver or session receives.
 * The returned future signals that processing finished; a failed future, or an
 * exception thrown by the call, counts as a processing failure.
 */
@FunctionalInterface
public interface MessageHandler {

    CompletableFuture<Void> onMessage(ReceivedMessage message);
}
