package com.sbus.context;

import com.sbus.config.ClientConfig;
import com.sbus.events.EntityEvent;
import com.sbus.events.EntityEventSink;
import com.sbus.management.ManagementClient;
import com.sbus.management.ManagementClientFactory;
import com.sbus.protocol.v10.connection.AmqpConnection;
import com.sbus.security.ClaimNegotiator;
import com.sbus.util.EventLoop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Namespace-level state shared by every client on one AMQP connection: the
 * transport, the security and management collaborators, configuration, the event
 * loop and the entity contexts created on it.
 */
public class ConnectionContext {

    private static final Logger log = LoggerFactory.getLogger(ConnectionContext.class);

    private final AmqpConnection connection;
    private final ClaimNegotiator claimNegotiator;
    private final ManagementClientFactory managementClientFactory;
    private final ClientConfig config;
    private final EventLoop eventLoop;
    private final EntityEventSink eventSink;

    // One management client per entity path, shared by all clients of that path
    private final Map<String, ManagementClient> managementClients = new ConcurrentHashMap<>();
    private final List<ClientEntityContext> entityContexts = new CopyOnWriteArrayList<>();

    public ConnectionContext(AmqpConnection connection, ClaimNegotiator claimNegotiator,
                             ManagementClientFactory managementClientFactory, ClientConfig config,
                             EventLoop eventLoop, EntityEventSink eventSink) {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.claimNegotiator = Objects.requireNonNull(claimNegotiator, "claimNegotiator");
        this.managementClientFactory = Objects.requireNonNull(managementClientFactory, "managementClientFactory");
        this.config = Objects.requireNonNull(config, "config");
        this.eventLoop = Objects.requireNonNull(eventLoop, "eventLoop");
        this.eventSink = eventSink != null ? eventSink : EntityEventSink.NOOP;
    }

    public String getConnectionId() {
        return connection.getConnectionId();
    }

    public AmqpConnection getConnection() {
        return connection;
    }

    public ClaimNegotiator getClaimNegotiator() {
        return claimNegotiator;
    }

    public ClientConfig getConfig() {
        return config;
    }

    public EventLoop getEventLoop() {
        return eventLoop;
    }

    public EntityEventSink getEventSink() {
        return eventSink;
    }

    /**
     * Token audience of an entity path.
     */
    public String audienceFor(String entityPath) {
        String endpoint = config.getEndpoint();
        return endpoint.endsWith("/") ? endpoint + entityPath : endpoint + "/" + entityPath;
    }

    /**
     * The management client of {@code entityPath}, created on first use.
     */
    public ManagementClient managementClientFor(String entityPath) {
        return managementClients.computeIfAbsent(entityPath, path -> {
            String address = path + "/$management";
            log.debug("[{}] Creating management client for '{}' at '{}'", getConnectionId(), path, address);
            return managementClientFactory.create(path, address, audienceFor(address));
        });
    }

    public ClientEntityContext createEntityContext(String entityPath) {
        ClientEntityContext entityContext = new ClientEntityContext(this, entityPath);
        entityContexts.add(entityContext);
        log.debug("[{}] Created entity context for '{}'", getConnectionId(), entityPath);
        return entityContext;
    }

    public List<ClientEntityContext> getEntityContexts() {
        return new ArrayList<>(entityContexts);
    }

    /**
     * Forget an entity context. The management client of its path is closed once
     * no other context uses the path.
     */
    public CompletableFuture<Void> removeEntityContext(ClientEntityContext entityContext) {
        entityContexts.remove(entityContext);
        String path = entityContext.getEntityPath();
        boolean pathInUse = entityContexts.stream().anyMatch(c -> c.getEntityPath().equals(path));
        if (pathInUse) {
            return CompletableFuture.completedFuture(null);
        }
        ManagementClient managementClient = managementClients.remove(path);
        if (managementClient == null) {
            return CompletableFuture.completedFuture(null);
        }
        return managementClient.close().exceptionally(e -> {
            log.warn("[{}] Error closing management client of '{}'", getConnectionId(), path, e);
            return null;
        });
    }

    /**
     * The connection failed: ask every entity to recover, one entity context after another.
     */
    public CompletableFuture<Void> onConnectionDisconnected(Throwable error) {
        log.warn("[{}] Connection disconnected, recovering {} entity contexts. Error: {}",
                getConnectionId(), entityContexts.size(), error != null ? error.toString() : "none");
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (ClientEntityContext entityContext : entityContexts) {
            chain = chain.thenCompose(v -> entityContext.detached(error));
        }
        return chain;
    }

    public void emit(EntityEvent event) {
        try {
            eventSink.record(event);
        } catch (RuntimeException e) {
            log.warn("Event sink failed for {}", event.getType(), e);
        }
    }
}
