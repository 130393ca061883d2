package com.sbus.util;

import java.time.Duration;
import java.time.Instant;

/**
 * Timing of lock renewals.
 */
public final class LockRenewalDurations {

    /**
     * Largest margin kept between a renewal and the lock expiry.
     */
    public static final Duration MAX_RENEW_BUFFER = Duration.ofSeconds(10);

    /**
     * Locks with this little time left are renewed at once.
     */
    public static final Duration MIN_LOCK_VALIDITY = Duration.ofSeconds(1);

    private LockRenewalDurations() {
    }

    /**
     * How long to wait before renewing a lock held until {@code lockedUntil}:
     * the remaining time minus half of it, capped at {@link #MAX_RENEW_BUFFER}.
     */
    public static Duration renewAfter(Instant lockedUntil, Instant now) {
        Duration remaining = Duration.between(now, lockedUntil);
        if (remaining.compareTo(MIN_LOCK_VALIDITY) <= 0) {
            return Duration.ZERO;
        }
        Duration half = remaining.dividedBy(2);
        Duration buffer = half.compareTo(MAX_RENEW_BUFFER) < 0 ? half : MAX_RENEW_BUFFER;
        return remaining.minus(buffer);
    }
}
