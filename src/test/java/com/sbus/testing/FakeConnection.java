package com.sbus.testing;

import com.sbus.protocol.v10.connection.AmqpConnection;
import com.sbus.protocol.v10.connection.LinkEvents;
import com.sbus.protocol.v10.connection.ReceiverEvents;
import com.sbus.protocol.v10.connection.ReceiverLink;
import com.sbus.protocol.v10.connection.ReceiverLinkOptions;
import com.sbus.protocol.v10.connection.SenderLink;
import com.sbus.protocol.v10.connection.SenderLinkOptions;
import com.sbus.protocol.v10.transport.AmqpErrorException;
import com.sbus.protocol.v10.transport.ErrorCondition;
import com.sbus.protocol.v10.types.Symbol;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Connection whose attaches succeed at once unless the test queued failures or
 * asked to hold them.
 */
public class FakeConnection implements AmqpConnection {

    private final String connectionId;
    private final List<FakeReceiverLink> receivers = new ArrayList<>();
    private final List<FakeSenderLink> senders = new ArrayList<>();
    private final Deque<ErrorCondition> attachFailures = new ArrayDeque<>();
    private final Deque<CompletableFuture<ReceiverLink>> heldAttaches = new ArrayDeque<>();
    private final Deque<FakeReceiverLink> heldLinks = new ArrayDeque<>();
    private final Map<Symbol, Object> nextRemoteFilter = new LinkedHashMap<>();
    private final Map<Symbol, Object> nextRemoteProperties = new LinkedHashMap<>();
    private final List<String> attachLog = new ArrayList<>();
    private boolean holdAttaches;
    private int attachCount;

    public FakeConnection() {
        this("connection-1");
    }

    public FakeConnection(String connectionId) {
        this.connectionId = connectionId;
    }

    @Override
    public String getConnectionId() {
        return connectionId;
    }

    @Override
    public boolean isOpen() {
        return true;
    }

    @Override
    public CompletableFuture<ReceiverLink> createReceiver(ReceiverLinkOptions options, ReceiverEvents events) {
        attachCount++;
        attachLog.add(options.getName());
        ErrorCondition failure = attachFailures.poll();
        if (failure != null) {
            return CompletableFuture.failedFuture(new AmqpErrorException(failure));
        }
        FakeReceiverLink link = new FakeReceiverLink(options, events);
        link.getRemoteSourceFilter().putAll(nextRemoteFilter);
        link.getRemoteProperties().putAll(nextRemoteProperties);
        receivers.add(link);
        if (holdAttaches) {
            CompletableFuture<ReceiverLink> held = new CompletableFuture<>();
            heldAttaches.add(held);
            heldLinks.add(link);
            return held;
        }
        return CompletableFuture.completedFuture(link);
    }

    @Override
    public CompletableFuture<SenderLink> createSender(SenderLinkOptions options, LinkEvents events) {
        attachCount++;
        attachLog.add(options.getName());
        ErrorCondition failure = attachFailures.poll();
        if (failure != null) {
            return CompletableFuture.failedFuture(new AmqpErrorException(failure));
        }
        FakeSenderLink link = new FakeSenderLink(options, events);
        senders.add(link);
        return CompletableFuture.completedFuture(link);
    }

    /**
     * Fail the next attach with {@code error}.
     */
    public void failNextAttach(ErrorCondition error) {
        attachFailures.add(error);
    }

    public void setHoldAttaches(boolean holdAttaches) {
        this.holdAttaches = holdAttaches;
    }

    /**
     * Complete the oldest held receiver attach.
     */
    public FakeReceiverLink releaseHeldAttach() {
        FakeReceiverLink link = heldLinks.poll();
        CompletableFuture<ReceiverLink> held = heldAttaches.poll();
        if (held == null) {
            throw new IllegalStateException("No attach is held");
        }
        held.complete(link);
        return link;
    }

    public int heldAttachCount() {
        return heldAttaches.size();
    }

    /**
     * Source filter entries the broker echoes in its next receiver attach.
     */
    public void setNextRemoteFilter(Symbol key, Object value) {
        nextRemoteFilter.put(key, value);
    }

    public void setNextRemoteProperty(Symbol key, Object value) {
        nextRemoteProperties.put(key, value);
    }

    public int getAttachCount() {
        return attachCount;
    }

    /**
     * Names of all links whose attach was requested, in order.
     */
    public List<String> getAttachLog() {
        return attachLog;
    }

    public List<FakeReceiverLink> getReceivers() {
        return receivers;
    }

    public FakeReceiverLink latestReceiver() {
        return receivers.isEmpty() ? null : receivers.get(receivers.size() - 1);
    }

    public List<FakeSenderLink> getSenders() {
        return senders;
    }

    public FakeSenderLink latestSender() {
        return senders.isEmpty() ? null : senders.get(senders.size() - 1);
    }
}
