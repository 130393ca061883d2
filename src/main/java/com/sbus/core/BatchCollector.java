package com.sbus.core;

import com.sbus.model.ReceivedMessage;
import com.sbus.util.EventLoop;
import com.sbus.util.ScheduledTask;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Collects the messages of one batch request. The batch resolves when it is
 * full, when no message arrived for the idle timeout after the last one, or
 * when the maximum wait time has passed. Used on the event loop only.
 */
public final class BatchCollector {

    private final EventLoop eventLoop;
    private final int maxMessageCount;
    private final Duration maxWaitTime;
    private final Duration idleTimeout;
    private final Consumer<BatchCollector> onFinished;
    private final List<ReceivedMessage> messages = new ArrayList<>();
    private final CompletableFuture<List<ReceivedMessage>> future = new CompletableFuture<>();

    private ScheduledTask maxWaitTimer;
    private ScheduledTask idleTimer;
    private boolean done;

    public BatchCollector(EventLoop eventLoop, int maxMessageCount, Duration maxWaitTime, Duration idleTimeout,
                          Consumer<BatchCollector> onFinished) {
        if (maxMessageCount < 1) {
            throw new IllegalArgumentException("maxMessageCount must be at least 1: " + maxMessageCount);
        }
        this.eventLoop = eventLoop;
        this.maxMessageCount = maxMessageCount;
        this.maxWaitTime = maxWaitTime;
        this.idleTimeout = idleTimeout;
        this.onFinished = onFinished;
    }

    /**
     * Start the maximum wait timer.
     */
    public void start() {
        if (done || maxWaitTimer != null) {
            return;
        }
        maxWaitTimer = eventLoop.schedule(this::finish, maxWaitTime);
    }

    public void add(ReceivedMessage message) {
        if (done) {
            return;
        }
        messages.add(message);
        if (messages.size() >= maxMessageCount) {
            finish();
            return;
        }
        if (idleTimer != null) {
            idleTimer.cancel();
        }
        idleTimer = eventLoop.schedule(this::finish, idleTimeout);
    }

    /**
     * Resolve with the messages collected so far.
     */
    public void finish() {
        if (done) {
            return;
        }
        done = true;
        cancelTimers();
        future.complete(Collections.unmodifiableList(new ArrayList<>(messages)));
        onFinished.accept(this);
    }

    public void fail(Throwable error) {
        if (done) {
            return;
        }
        done = true;
        cancelTimers();
        future.completeExceptionally(error);
        onFinished.accept(this);
    }

    private void cancelTimers() {
        if (maxWaitTimer != null) {
            maxWaitTimer.cancel();
        }
        if (idleTimer != null) {
            idleTimer.cancel();
        }
    }

    public boolean isDone() {
        return done;
    }

    public int getMaxMessageCount() {
        return maxMessageCount;
    }

    /**
     * Messages still missing for a full batch.
     */
    public int remaining() {
        return maxMessageCount - messages.size();
    }

    public int size() {
        return messages.size();
    }

    public CompletableFuture<List<ReceivedMessage>> getFuture() {
        return future;
    }
}
