package com.sbus.client;

import com.sbus.config.ClientConfig;
import com.sbus.context.ConnectionContext;
import com.sbus.core.ReceiveMode;
import com.sbus.events.JsonLogEventSink;
import com.sbus.management.ManagementClientFactory;
import com.sbus.protocol.v10.connection.AmqpConnection;
import com.sbus.security.ClaimNegotiator;
import com.sbus.util.NettyEventLoop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Entry point: one AMQP connection to a namespace and the clients created on it.
 */
public class Namespace {

    private static final Logger log = LoggerFactory.getLogger(Namespace.class);

    private final ConnectionContext connectionContext;
    private final NettyEventLoop ownedEventLoop;
    private final List<QueueClient> clients = new CopyOnWriteArrayList<>();

    /**
     * A namespace with its own event loop, logging entity events as JSON.
     */
    public Namespace(AmqpConnection connection, ClaimNegotiator claimNegotiator,
                     ManagementClientFactory managementClientFactory, ClientConfig config) {
        this.ownedEventLoop = new NettyEventLoop();
        this.connectionContext = new ConnectionContext(connection, claimNegotiator, managementClientFactory,
                config, ownedEventLoop, new JsonLogEventSink());
    }

    public Namespace(ConnectionContext connectionContext) {
        this.connectionContext = connectionContext;
        this.ownedEventLoop = null;
    }

    public ConnectionContext getConnectionContext() {
        return connectionContext;
    }

    public QueueClient createQueueClient(String queueName) {
        return createQueueClient(queueName, ReceiveMode.PEEK_LOCK);
    }

    public QueueClient createQueueClient(String queueName, ReceiveMode receiveMode) {
        QueueClient client = new QueueClient(connectionContext, queueName, receiveMode);
        clients.add(client);
        log.debug("[{}] Created client of '{}' in {} mode", connectionContext.getConnectionId(), queueName, receiveMode);
        return client;
    }

    /**
     * The transport reports that the connection dropped; every entity is recovered.
     */
    public CompletableFuture<Void> onConnectionDisconnected(Throwable error) {
        return connectionContext.onConnectionDisconnected(error);
    }

    /**
     * Close all clients, then the event loop if this namespace created it.
     */
    public CompletableFuture<Void> close() {
        List<CompletableFuture<Void>> closing = new ArrayList<>();
        for (QueueClient client : clients) {
            closing.add(client.close());
        }
        clients.clear();
        return CompletableFuture.allOf(closing.toArray(new CompletableFuture[0]))
                .whenComplete((v, e) -> {
                    if (e != null) {
                        log.warn("[{}] Error closing clients", connectionContext.getConnectionId(), e);
                    }
                    if (ownedEventLoop != null) {
                        ownedEventLoop.close();
                    }
                });
    }
}
