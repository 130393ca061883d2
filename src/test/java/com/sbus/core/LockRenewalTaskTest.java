package com.sbus.core;

import com.sbus.errors.MessagingErrorCode;
import com.sbus.errors.MessagingException;
import com.sbus.protocol.v10.transport.AmqpErrorException;
import com.sbus.protocol.v10.transport.ErrorCondition;
import com.sbus.testing.ManualEventLoop;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.*;

class LockRenewalTaskTest {

    private ManualEventLoop loop;
    private Instant lockedUntil;
    private List<Instant> renewed;
    private List<MessagingException> failures;
    private int renewCalls;

    @BeforeEach
    void setUp() {
        loop = new ManualEventLoop();
        lockedUntil = loop.now().plusSeconds(30);
        renewed = new ArrayList<>();
        failures = new ArrayList<>();
    }

    private LockRenewalTask task(Duration maxRenew, Supplier<CompletableFuture<Instant>> renewal) {
        return new LockRenewalTask(loop, "message 'm1'", loop.now().plus(maxRenew),
                () -> lockedUntil,
                () -> {
                    renewCalls++;
                    return renewal.get();
                },
                until -> {
                    lockedUntil = until;
                    renewed.add(until);
                },
                failures::add);
    }

    private CompletableFuture<Instant> thirtySecondsMore() {
        return CompletableFuture.completedFuture(loop.now().plusSeconds(30));
    }

    @Test
    void testRenewsTenSecondsBeforeExpiry() {
        LockRenewalTask task = task(Duration.ofMinutes(5), this::thirtySecondsMore);
        task.start();

        loop.advanceBy(Duration.ofSeconds(19));
        assertThat(renewCalls).isZero();

        loop.advanceBy(Duration.ofSeconds(1));
        assertThat(renewCalls).isEqualTo(1);
        assertThat(lockedUntil).isEqualTo(ManualEventLoop.START.plusSeconds(50));

        loop.advanceBy(Duration.ofSeconds(20));
        assertThat(task.getRenewals()).isEqualTo(2);
        assertThat(task.isActive()).isTrue();
    }

    @Test
    void testCancelStopsRenewal() {
        LockRenewalTask task = task(Duration.ofMinutes(5), this::thirtySecondsMore);
        task.start();

        task.cancel();
        loop.advanceBy(Duration.ofMinutes(1));

        assertThat(renewCalls).isZero();
        assertThat(task.isActive()).isFalse();
        assertThat(loop.pendingTimerCount()).isZero();
    }

    @Test
    void testOutcomeAfterCancelIsIgnored() {
        CompletableFuture<Instant> inFlight = new CompletableFuture<>();
        LockRenewalTask task = task(Duration.ofMinutes(5), () -> inFlight);
        task.start();
        loop.advanceBy(Duration.ofSeconds(20));

        task.cancel();
        inFlight.completeExceptionally(new AmqpErrorException(new ErrorCondition(ErrorCondition.MESSAGE_LOCK_LOST)));

        assertThat(failures).isEmpty();
        assertThat(renewed).isEmpty();
    }

    @Test
    void testFailureIsReportedOnceAndEndsTheTask() {
        LockRenewalTask task = task(Duration.ofMinutes(5), () -> CompletableFuture.failedFuture(
                new AmqpErrorException(new ErrorCondition(ErrorCondition.MESSAGE_LOCK_LOST, "expired"))));
        task.start();

        loop.advanceBy(Duration.ofMinutes(2));

        assertThat(renewCalls).isEqualTo(1);
        assertThat(failures).singleElement()
                .satisfies(e -> assertThat(e.getCode()).isEqualTo(MessagingErrorCode.MESSAGE_LOCK_LOST));
        assertThat(task.isActive()).isFalse();
    }

    @Test
    void testStopsAtDeadline() {
        LockRenewalTask task = task(Duration.ofSeconds(15), this::thirtySecondsMore);
        task.start();

        loop.advanceBy(Duration.ofMinutes(1));

        assertThat(renewCalls).isZero();
        assertThat(task.isActive()).isFalse();
    }

    @Test
    void testThrowingRenewalIsAFailure() {
        LockRenewalTask task = task(Duration.ofMinutes(5), () -> {
            throw new IllegalStateException("management link closed");
        });
        task.start();

        loop.advanceBy(Duration.ofSeconds(20));

        assertThat(failures).singleElement()
                .satisfies(e -> assertThat(e.getCode()).isEqualTo(MessagingErrorCode.CLIENT_ERROR));
    }
}
