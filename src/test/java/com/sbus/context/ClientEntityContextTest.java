package com.sbus.context;

import com.sbus.core.BatchingReceiver;
import com.sbus.core.MessageSender;
import com.sbus.core.ReceiveOptions;
import com.sbus.core.StreamingReceiver;
import com.sbus.model.OutgoingMessage;
import com.sbus.protocol.v10.connection.LinkState;
import com.sbus.session.MessageSession;
import com.sbus.session.SessionReceiverOptions;
import com.sbus.testing.EntityFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.*;

class ClientEntityContextTest {

    private EntityFixture fixture;
    private ClientEntityContext context;

    @BeforeEach
    void setUp() {
        fixture = new EntityFixture();
        context = fixture.context;
    }

    private StreamingReceiver streaming() {
        StreamingReceiver receiver = new StreamingReceiver(context, new ReceiveOptions()
                .setMaxAutoRenewDuration(Duration.ZERO));
        receiver.receive(message -> CompletableFuture.completedFuture(null), error -> { });
        return receiver;
    }

    @Test
    void testOpenedReceiversAreRegisteredByKind() {
        StreamingReceiver streaming = streaming();
        BatchingReceiver batching = new BatchingReceiver(context, new ReceiveOptions());
        batching.receive(1, Duration.ofSeconds(10));

        assertThat(context.getStreamingReceiver()).isSameAs(streaming);
        assertThat(context.getBatchingReceiver()).isSameAs(batching);
        assertThat(context.getReceiver(streaming.getName())).isSameAs(streaming);
        assertThat(context.getReceiver(batching.getName())).isSameAs(batching);
        assertThat(context.getReceiver("unknown")).isNull();
    }

    @Test
    @DisplayName("A second receiver of the same kind does not replace the registered one")
    void testSlotIsNotOverwritten() {
        StreamingReceiver first = streaming();
        StreamingReceiver second = streaming();

        assertThat(second.isOpen()).isTrue();
        assertThat(context.registerReceiver(second)).isFalse();
        assertThat(context.getStreamingReceiver()).isSameAs(first);

        first.close();
        assertThat(context.getStreamingReceiver()).isNull();
        assertThat(context.registerReceiver(second)).isTrue();
    }

    @Test
    void testSessionsAreKeyedBySessionId() {
        MessageSession a = new MessageSession(context, new SessionReceiverOptions().setSessionId("a")).accept().join();
        MessageSession b = new MessageSession(context, new SessionReceiverOptions().setSessionId("b")).accept().join();

        assertThat(context.getMessageSessions()).containsOnlyKeys("a", "b");
        assertThat(context.getReceiver(b.getName())).isSameAs(b);

        a.close();
        assertThat(context.getMessageSessions()).containsOnlyKeys("b");
    }

    @Test
    @DisplayName("A connection failure reopens the sender, then batching, streaming and session receivers")
    void testDetachedReopensInOrder() {
        StreamingReceiver streaming = streaming();
        MessageSession session = new MessageSession(context, new SessionReceiverOptions().setSessionId("s-1"))
                .accept().join();
        BatchingReceiver batching = new BatchingReceiver(context, new ReceiveOptions());
        batching.receive(1, Duration.ofSeconds(10));
        MessageSender sender = new MessageSender(context);
        sender.send(new OutgoingMessage("hello"));
        int before = fixture.connection.getAttachLog().size();

        CompletableFuture<Void> recovered = context.detached(new IOException("connection reset"));

        assertThat(recovered).isCompleted();
        List<String> reattached = new ArrayList<>(
                fixture.connection.getAttachLog().subList(before, fixture.connection.getAttachLog().size()));
        assertThat(reattached).containsExactly(
                sender.getName(), batching.getName(), streaming.getName(), session.getName());
        assertThat(List.of(sender.getState(), batching.getState(), streaming.getState(), session.getState()))
                .containsOnly(LinkState.OPEN);
    }

    @Test
    void testDetachedSkipsEntitiesAlreadyReconnecting() {
        StreamingReceiver streaming = streaming();
        fixture.connection.setHoldAttaches(true);
        fixture.connection.latestReceiver().detachRemotely(null);
        int attaches = fixture.connection.getAttachCount();

        context.detached(new IOException("connection reset"));

        assertThat(fixture.connection.getAttachCount()).isEqualTo(attaches);
        assertThat(streaming.getState()).isEqualTo(LinkState.CONNECTING);
    }

    @Test
    void testCloseClosesEntitiesAndClearsLockStore() {
        StreamingReceiver streaming = streaming();
        context.getRequestResponseLockedMessages()
                .set(UUID.randomUUID(), Instant.now(), Duration.ofMinutes(1));

        context.close();

        assertThat(streaming.getState()).isEqualTo(LinkState.CLOSED);
        assertThat(context.getRequestResponseLockedMessages().size()).isZero();
    }

    @Test
    void testAudienceAndClientId() {
        assertThat(context.getAudience()).isEqualTo(fixture.config.getEndpoint() + EntityFixture.ENTITY_PATH);
        assertThat(context.getClientId()).startsWith(EntityFixture.ENTITY_PATH + "-");
    }
}
