package com.sbus.core;

import com.sbus.errors.MessagingErrorCode;
import com.sbus.errors.MessagingException;
import com.sbus.events.EntityEvent.EventType;
import com.sbus.model.ReceivedMessage;
import com.sbus.protocol.v10.connection.LinkState;
import com.sbus.protocol.v10.delivery.Accepted;
import com.sbus.protocol.v10.delivery.Modified;
import com.sbus.protocol.v10.transport.ErrorCondition;
import com.sbus.testing.EntityFixture;
import com.sbus.testing.FakeDelivery;
import com.sbus.testing.FakeReceiverLink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class StreamingReceiverTest {

    private EntityFixture fixture;
    private List<ReceivedMessage> handled;
    private List<Throwable> errors;

    @BeforeEach
    void setUp() {
        fixture = new EntityFixture();
        handled = new ArrayList<>();
        errors = new ArrayList<>();
    }

    private StreamingReceiver receiver(ReceiveOptions options) {
        return new StreamingReceiver(fixture.context, options);
    }

    private MessageHandler completing() {
        return message -> {
            handled.add(message);
            return CompletableFuture.completedFuture(null);
        };
    }

    @Test
    @DisplayName("Grants maxConcurrentCalls credit when the link opens")
    void testInitialCredit() {
        StreamingReceiver receiver = receiver(new ReceiveOptions().setMaxConcurrentCalls(4));

        assertThat(receiver.receive(completing(), errors::add)).isCompleted();

        FakeReceiverLink link = fixture.connection.latestReceiver();
        assertThat(link.getCreditGrants()).containsExactly(4);
        assertThat(receiver.isReceiving()).isTrue();
        assertThat(receiver.getState()).isEqualTo(LinkState.OPEN);
        assertThat(fixture.context.getStreamingReceiver()).isSameAs(receiver);
        assertThat(fixture.claimCount.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("Auto-completes a handled message and replenishes credit once it is settled")
    void testAutoCompleteThenReplenish() {
        StreamingReceiver receiver = receiver(new ReceiveOptions()
                .setMaxConcurrentCalls(2)
                .setAutoComplete(true)
                .setMaxAutoRenewDuration(Duration.ZERO));
        receiver.receive(completing(), errors::add);
        FakeReceiverLink link = fixture.connection.latestReceiver();

        FakeDelivery delivery = link.deliver(fixture.message("m1"));

        assertThat(handled).extracting(ReceivedMessage::getMessageId).containsExactly("m1");
        assertThat(delivery.lastDisposition()).isSameAs(Accepted.INSTANCE);
        assertThat(link.getCreditGrants()).containsExactly(2);

        link.acknowledge(delivery);

        assertThat(link.getCreditGrants()).containsExactly(2, 1);
        assertThat(errors).isEmpty();
    }

    @Test
    @DisplayName("A handler finishing before the renewal is due completes once and never renews")
    void testQuickHandlerCompletesWithoutRenewal() {
        CompletableFuture<Void> handlerDone = new CompletableFuture<>();
        StreamingReceiver receiver = receiver(new ReceiveOptions()
                .setMaxConcurrentCalls(1)
                .setAutoComplete(true));
        receiver.receive(message -> {
            handled.add(message);
            return handlerDone;
        }, errors::add);
        FakeReceiverLink link = fixture.connection.latestReceiver();
        assertThat(receiver.isAutoRenewLock()).isTrue();

        FakeDelivery delivery = link.deliver(fixture.lockedMessage("m1", Duration.ofSeconds(30)));
        assertThat(receiver.getActiveLockRenewalCount()).isEqualTo(1);

        fixture.loop.advanceBy(Duration.ofSeconds(1));
        handlerDone.complete(null);
        link.acknowledge(delivery);
        fixture.loop.advanceBy(Duration.ofSeconds(61));

        verify(fixture.management, never()).renewLock(any(UUID.class));
        assertThat(delivery.getDispositions()).containsExactly(Accepted.INSTANCE);
        assertThat(receiver.getActiveLockRenewalCount()).isZero();
        assertThat(errors).isEmpty();
    }

    @Test
    void testNoAutoCompleteLeavesSettlementToHandler() {
        StreamingReceiver receiver = receiver(new ReceiveOptions()
                .setAutoComplete(false)
                .setMaxAutoRenewDuration(Duration.ZERO));
        receiver.receive(message -> message.defer(), errors::add);
        FakeReceiverLink link = fixture.connection.latestReceiver();

        FakeDelivery delivery = link.deliver(fixture.message("m1"));
        link.acknowledge(delivery);

        assertThat(delivery.getDispositions()).hasSize(1);
        assertThat(((Modified) delivery.lastDisposition()).isUndeliverableHere()).isTrue();
        assertThat(link.getCreditGrants()).containsExactly(1, 1);
    }

    @Test
    @DisplayName("Renews the lock while the handler runs and stops when it finishes")
    void testLockRenewedDuringHandler() {
        when(fixture.management.renewLock(any(UUID.class)))
                .thenAnswer(inv -> CompletableFuture.completedFuture(fixture.loop.now().plusSeconds(30)));
        CompletableFuture<Void> handlerDone = new CompletableFuture<>();
        StreamingReceiver receiver = receiver(new ReceiveOptions()
                .setMaxAutoRenewDuration(Duration.ofSeconds(60)));
        receiver.receive(message -> {
            handled.add(message);
            return handlerDone;
        }, errors::add);
        FakeReceiverLink link = fixture.connection.latestReceiver();

        link.deliver(fixture.lockedMessage("m1", Duration.ofSeconds(30)));
        ReceivedMessage message = handled.get(0);
        assertThat(receiver.getActiveLockRenewalCount()).isEqualTo(1);

        fixture.loop.advanceBy(Duration.ofSeconds(20));
        verify(fixture.management, times(1)).renewLock(message.getLockToken());
        assertThat(message.getLockedUntil()).isEqualTo(fixture.loop.now().plusSeconds(30));

        fixture.loop.advanceBy(Duration.ofSeconds(15));
        handlerDone.complete(null);

        assertThat(receiver.getActiveLockRenewalCount()).isZero();
        fixture.loop.advanceBy(Duration.ofMinutes(2));
        verify(fixture.management, times(1)).renewLock(any(UUID.class));
        assertThat(fixture.events.count(EventType.LOCK_RENEWED)).isEqualTo(1);
        assertThat(errors).isEmpty();
    }

    @Test
    @DisplayName("Stops renewing at the maximum auto-renew duration")
    void testLockRenewalStopsAtDeadline() {
        when(fixture.management.renewLock(any(UUID.class)))
                .thenAnswer(inv -> CompletableFuture.completedFuture(fixture.loop.now().plusSeconds(30)));
        StreamingReceiver receiver = receiver(new ReceiveOptions()
                .setMaxAutoRenewDuration(Duration.ofSeconds(60)));
        receiver.receive(message -> new CompletableFuture<>(), errors::add);

        fixture.connection.latestReceiver().deliver(fixture.lockedMessage("m1", Duration.ofSeconds(30)));
        fixture.loop.advanceBy(Duration.ofMinutes(10));

        // The renewal due at 60 s falls on the deadline
        verify(fixture.management, times(2)).renewLock(any(UUID.class));
    }

    @Test
    @DisplayName("A handler failing with lock lost is reported and the message is not abandoned")
    void testHandlerLockLost() {
        MessagingException lockLost = new MessagingException(MessagingErrorCode.MESSAGE_LOCK_LOST, "lock lost");
        StreamingReceiver receiver = receiver(new ReceiveOptions().setMaxAutoRenewDuration(Duration.ZERO));
        receiver.receive(message -> CompletableFuture.failedFuture(lockLost), errors::add);
        FakeReceiverLink link = fixture.connection.latestReceiver();

        FakeDelivery delivery = link.deliver(fixture.message("m1"));

        assertThat(errors).containsExactly(lockLost);
        assertThat(delivery.getDispositions()).isEmpty();
        assertThat(link.getCreditGrants()).containsExactly(1, 1);
    }

    @Test
    @DisplayName("A throwing handler gets its error reported and the message abandoned")
    void testHandlerFailureAbandons() {
        IllegalArgumentException boom = new IllegalArgumentException("boom");
        StreamingReceiver receiver = receiver(new ReceiveOptions().setMaxAutoRenewDuration(Duration.ZERO));
        receiver.receive(message -> {
            throw boom;
        }, errors::add);
        FakeReceiverLink link = fixture.connection.latestReceiver();

        FakeDelivery delivery = link.deliver(fixture.message("m1"));

        assertThat(errors).containsExactly(boom);
        Modified abandoned = (Modified) delivery.lastDisposition();
        assertThat(abandoned.isUndeliverableHere()).isFalse();

        link.acknowledge(delivery);
        assertThat(link.getCreditGrants()).containsExactly(1, 1);
    }

    @Test
    @DisplayName("A handler that fails after its own complete was rejected still abandons the message")
    void testHandlerFailureAfterRejectedCompleteAbandons() {
        IllegalStateException processingFailed = new IllegalStateException("processing failed");
        StreamingReceiver receiver = receiver(new ReceiveOptions().setMaxAutoRenewDuration(Duration.ZERO));
        receiver.receive(message -> message.complete().handle((v, e) -> {
            throw processingFailed;
        }), errors::add);
        FakeReceiverLink link = fixture.connection.latestReceiver();

        FakeDelivery delivery = link.deliver(fixture.message("m1"));
        assertThat(delivery.getDispositions()).containsExactly(Accepted.INSTANCE);

        link.rejectSettlement(delivery, new ErrorCondition(ErrorCondition.INTERNAL_ERROR, "store unavailable"));

        assertThat(errors).containsExactly(processingFailed);
        assertThat(delivery.getDispositions()).hasSize(2);
        assertThat(((Modified) delivery.lastDisposition()).isUndeliverableHere()).isFalse();
    }

    @Test
    void testSecondReceiveFails() {
        StreamingReceiver receiver = receiver(new ReceiveOptions());
        receiver.receive(completing(), errors::add);

        CompletableFuture<Void> second = receiver.receive(completing(), errors::add);

        assertThat(second).isCompletedExceptionally();
        assertThatThrownBy(second::join).hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("A failed attach is reported to onError and receiving can be retried")
    void testInitFailureReported() {
        fixture.connection.failNextAttach(new ErrorCondition(ErrorCondition.UNAUTHORIZED_ACCESS, "denied"));
        StreamingReceiver receiver = receiver(new ReceiveOptions());

        CompletableFuture<Void> started = receiver.receive(completing(), errors::add);

        assertThat(started).isCompletedExceptionally();
        assertThat(errors).singleElement()
                .isInstanceOfSatisfying(MessagingException.class,
                        e -> assertThat(e.getCode()).isEqualTo(MessagingErrorCode.UNAUTHORIZED));
        assertThat(receiver.getState()).isEqualTo(LinkState.CLOSED);
        assertThat(receiver.isReceiving()).isFalse();
        assertThat(fixture.events.count(EventType.LINK_OPEN_FAILED)).isEqualTo(1);

        assertThat(receiver.receive(completing(), errors::add)).isCompleted();
        assertThat(receiver.isReceiving()).isTrue();
    }

    @Test
    void testDeliveryAfterCloseIsDropped() {
        StreamingReceiver receiver = receiver(new ReceiveOptions());
        receiver.receive(completing(), errors::add);
        FakeReceiverLink link = fixture.connection.latestReceiver();

        receiver.close();
        link.deliver(fixture.message("late"));

        assertThat(handled).isEmpty();
        assertThat(link.isClosedLocally()).isTrue();
        assertThat(fixture.context.getStreamingReceiver()).isNull();
        assertThat(fixture.events.types()).contains(EventType.LINK_OPENED, EventType.LINK_CLOSED);
    }

    @Test
    void testReceiveAndDeleteDoesNotSettle() {
        StreamingReceiver receiver = receiver(new ReceiveOptions()
                .setReceiveMode(ReceiveMode.RECEIVE_AND_DELETE)
                .setAutoComplete(true));
        receiver.receive(completing(), errors::add);
        FakeReceiverLink link = fixture.connection.latestReceiver();

        FakeDelivery delivery = link.deliver(fixture.message("m1"));

        assertThat(handled).hasSize(1);
        assertThat(delivery.getDispositions()).isEmpty();
        assertThat(receiver.getActiveLockRenewalCount()).isZero();
        assertThat(link.getCreditGrants()).containsExactly(1, 1);
    }
}
