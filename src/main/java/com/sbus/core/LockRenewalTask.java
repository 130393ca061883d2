package com.sbus.core;

import com.sbus.errors.ErrorTranslator;
import com.sbus.errors.MessagingException;
import com.sbus.util.EventLoop;
import com.sbus.util.LockRenewalDurations;
import com.sbus.util.ScheduledTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Keeps a lock renewed until a deadline or until cancelled.
 *
 * Each renewal is scheduled shortly before the current lock expires, see
 * {@link LockRenewalDurations#renewAfter}. The deadline and cancellation are
 * checked again on every wake, so a cancelled task never renews. A failed renewal
 * is reported once and ends the task.
 */
public class LockRenewalTask {

    private static final Logger log = LoggerFactory.getLogger(LockRenewalTask.class);

    private final EventLoop eventLoop;
    private final String description;
    private final Instant deadline;
    private final Supplier<Instant> lockedUntil;
    private final Supplier<CompletableFuture<Instant>> renewal;
    private final Consumer<Instant> onRenewed;
    private final Consumer<MessagingException> onFailure;

    private volatile boolean active;
    private ScheduledTask timer;
    private int renewals;

    public LockRenewalTask(EventLoop eventLoop, String description, Instant deadline,
                           Supplier<Instant> lockedUntil, Supplier<CompletableFuture<Instant>> renewal,
                           Consumer<Instant> onRenewed, Consumer<MessagingException> onFailure) {
        this.eventLoop = Objects.requireNonNull(eventLoop, "eventLoop");
        this.description = description;
        this.deadline = Objects.requireNonNull(deadline, "deadline");
        this.lockedUntil = Objects.requireNonNull(lockedUntil, "lockedUntil");
        this.renewal = Objects.requireNonNull(renewal, "renewal");
        this.onRenewed = Objects.requireNonNull(onRenewed, "onRenewed");
        this.onFailure = Objects.requireNonNull(onFailure, "onFailure");
    }

    public void start() {
        active = true;
        scheduleNext();
    }

    public void cancel() {
        if (active) {
            log.debug("Cancelling lock renewal of {} after {} renewals", description, renewals);
        }
        active = false;
        if (timer != null) {
            timer.cancel();
            timer = null;
        }
    }

    public boolean isActive() {
        return active;
    }

    public int getRenewals() {
        return renewals;
    }

    private void scheduleNext() {
        if (!active) {
            return;
        }
        Instant now = eventLoop.now();
        Instant until = lockedUntil.get();
        if (!now.isBefore(deadline) || until == null) {
            log.debug("Stopping lock renewal of {}: deadline {} reached", description, deadline);
            active = false;
            return;
        }
        Duration delay = LockRenewalDurations.renewAfter(until, now);
        log.trace("Renewing lock of {} in {} ms", description, delay.toMillis());
        timer = eventLoop.schedule(this::renew, delay);
    }

    private void renew() {
        timer = null;
        if (!active) {
            return;
        }
        if (!eventLoop.now().isBefore(deadline)) {
            log.debug("Not renewing lock of {}: deadline {} reached", description, deadline);
            active = false;
            return;
        }
        CompletableFuture<Instant> renewed;
        try {
            renewed = renewal.get();
        } catch (RuntimeException e) {
            renewed = CompletableFuture.failedFuture(e);
        }
        eventLoop.relay(renewed).whenComplete((until, error) -> {
            if (!active) {
                log.debug("Lock renewal of {} finished after cancellation, ignoring the outcome", description);
                return;
            }
            if (error != null) {
                active = false;
                MessagingException translated = ErrorTranslator.translate(error);
                log.warn("Lock renewal of {} failed: {}", description, translated.toString());
                onFailure.accept(translated);
                return;
            }
            renewals++;
            log.debug("Renewed lock of {} until {}", description, until);
            onRenewed.accept(until);
            scheduleNext();
        });
    }
}
