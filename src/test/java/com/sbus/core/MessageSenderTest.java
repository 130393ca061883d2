package com.sbus.core;

import com.sbus.errors.MessagingErrorCode;
import com.sbus.errors.MessagingException;
import com.sbus.model.OutgoingMessage;
import com.sbus.protocol.v10.connection.LinkState;
import com.sbus.protocol.v10.delivery.Rejected;
import com.sbus.protocol.v10.delivery.Released;
import com.sbus.protocol.v10.messaging.AmqpMessage;
import com.sbus.protocol.v10.transport.ErrorCondition;
import com.sbus.testing.EntityFixture;
import com.sbus.testing.FakeSenderLink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.*;

class MessageSenderTest {

    private EntityFixture fixture;
    private MessageSender sender;

    @BeforeEach
    void setUp() {
        fixture = new EntityFixture();
        sender = new MessageSender(fixture.context);
    }

    @Test
    @DisplayName("Opens the link on first send and maps the message properties")
    void testSendOpensLink() {
        OutgoingMessage message = new OutgoingMessage("hello")
                .setMessageId("id-1")
                .setSessionId("s-1")
                .setLabel("greeting")
                .setTimeToLive(Duration.ofMinutes(1))
                .setPartitionKey("p")
                .setUserProperty("tenant", "acme");

        CompletableFuture<Void> sent = sender.send(message);

        assertThat(sent).isCompleted();
        assertThat(sent.isCompletedExceptionally()).isFalse();
        assertThat(sender.getState()).isEqualTo(LinkState.OPEN);
        assertThat(fixture.context.getSender()).isSameAs(sender);
        FakeSenderLink link = fixture.connection.latestSender();
        AmqpMessage amqp = link.getSent().get(0);
        assertThat(amqp.getBody()).isEqualTo("hello");
        assertThat(amqp.getMessageId()).isEqualTo("id-1");
        assertThat(amqp.getGroupId()).isEqualTo("s-1");
        assertThat(amqp.getSubject()).isEqualTo("greeting");
        assertThat(amqp.getTtlMillis()).isEqualTo(60_000L);
        assertThat(amqp.getMessageAnnotation(AmqpMessage.PARTITION_KEY)).isEqualTo("p");
        assertThat(amqp.getApplicationProperties()).containsEntry("tenant", "acme");
    }

    @Test
    void testSecondSendReusesLink() {
        sender.send(new OutgoingMessage("a"));
        sender.send(new OutgoingMessage("b"));

        assertThat(fixture.connection.getAttachCount()).isEqualTo(1);
        assertThat(fixture.connection.latestSender().getSent()).hasSize(2);
    }

    @Test
    @DisplayName("A rejected message fails without retrying")
    void testRejectedNotRetried() {
        sender.send(new OutgoingMessage("warmup"));
        FakeSenderLink link = fixture.connection.latestSender();
        link.queueOutcome(new Rejected(new ErrorCondition(ErrorCondition.MESSAGE_SIZE_EXCEEDED, "too big")));

        CompletableFuture<Void> sent = sender.send(new OutgoingMessage("huge"));

        assertThat(sent).isCompletedExceptionally();
        MessagingException error = (MessagingException) sent.handle((v, e) -> e).join();
        assertThat(error.getCode()).isEqualTo(MessagingErrorCode.MESSAGE_TOO_LARGE);
        assertThat(link.getSent()).hasSize(2);
    }

    @Test
    @DisplayName("An outcome other than Accepted is retried after the delay")
    void testReleasedIsRetried() {
        sender.send(new OutgoingMessage("warmup"));
        FakeSenderLink link = fixture.connection.latestSender();
        link.queueOutcome(Released.INSTANCE);

        CompletableFuture<Void> sent = sender.send(new OutgoingMessage("again"));
        assertThat(sent).isNotDone();

        fixture.loop.advanceBy(fixture.config.getOperationRetryDelay());

        assertThat(sent).isCompleted();
        assertThat(sent.isCompletedExceptionally()).isFalse();
        assertThat(link.getSent()).hasSize(3);
    }

    @Test
    void testAttachFailureRetried() {
        fixture.connection.failNextAttach(new ErrorCondition(ErrorCondition.SERVER_BUSY, "busy"));

        CompletableFuture<Void> sent = sender.send(new OutgoingMessage("x"));
        assertThat(sent).isNotDone();

        fixture.loop.advanceBy(fixture.config.getOperationRetryDelay());

        assertThat(sent.isCompletedExceptionally()).isFalse();
        assertThat(fixture.connection.getAttachCount()).isEqualTo(2);
    }

    @Test
    void testReopensAfterDetach() {
        sender.send(new OutgoingMessage("a"));
        FakeSenderLink first = fixture.connection.latestSender();

        first.detachRemotely(new ErrorCondition(ErrorCondition.DETACH_FORCED, "idle"));

        assertThat(fixture.connection.latestSender()).isNotSameAs(first);
        assertThat(sender.isOpen()).isTrue();
    }

    @Test
    void testCloseDeregisters() {
        sender.send(new OutgoingMessage("a"));

        sender.close();

        assertThat(fixture.context.getSender()).isNull();
        assertThat(sender.getState()).isEqualTo(LinkState.CLOSED);
    }
}
