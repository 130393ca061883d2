package com.sbus.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Map whose entries expire a fixed time after they were last set.
 *
 * Reads treat an expired entry as absent whether or not it has been swept yet.
 * A sweep scheduled on the event loop removes expired entries so the map does not
 * grow between reads.
 */
public class ConcurrentExpiringMap<K, V> implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConcurrentExpiringMap.class);

    public static final Duration DEFAULT_SWEEP_INTERVAL = Duration.ofMinutes(5);

    private final ConcurrentMap<K, Entry<V>> entries = new ConcurrentHashMap<>();
    private final EventLoop eventLoop;
    private final Duration sweepInterval;

    private volatile ScheduledTask sweepTask;
    private volatile boolean closed;

    public ConcurrentExpiringMap(EventLoop eventLoop) {
        this(eventLoop, DEFAULT_SWEEP_INTERVAL);
    }

    public ConcurrentExpiringMap(EventLoop eventLoop, Duration sweepInterval) {
        this.eventLoop = Objects.requireNonNull(eventLoop, "eventLoop");
        if (sweepInterval.isNegative() || sweepInterval.isZero()) {
            throw new IllegalArgumentException("sweepInterval must be positive: " + sweepInterval);
        }
        this.sweepInterval = sweepInterval;
        scheduleSweep();
    }

    /**
     * Insert or overwrite; the entry expires {@code ttl} from now.
     */
    public void set(K key, V value, Duration ttl) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(ttl, "ttl");
        entries.put(key, new Entry<>(value, eventLoop.now().plus(ttl)));
    }

    /**
     * @return the value, or null if absent or expired
     */
    public V get(K key) {
        Entry<V> entry = entries.get(key);
        if (entry == null) {
            return null;
        }
        if (entry.isExpired(eventLoop.now())) {
            entries.remove(key, entry);
            return null;
        }
        return entry.value;
    }

    public boolean has(K key) {
        return get(key) != null;
    }

    public boolean remove(K key) {
        return entries.remove(key) != null;
    }

    /**
     * Number of stored entries, including expired ones not yet swept.
     */
    public int size() {
        return entries.size();
    }

    public void clear() {
        entries.clear();
    }

    /**
     * Remove all entries that have expired.
     *
     * @return the number of entries removed
     */
    public int sweep() {
        Instant now = eventLoop.now();
        int removed = 0;
        for (Map.Entry<K, Entry<V>> e : entries.entrySet()) {
            if (e.getValue().isExpired(now) && entries.remove(e.getKey(), e.getValue())) {
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("Swept {} expired entries, {} remaining", removed, entries.size());
        }
        return removed;
    }

    private void scheduleSweep() {
        if (closed) {
            return;
        }
        sweepTask = eventLoop.schedule(() -> {
            sweep();
            scheduleSweep();
        }, sweepInterval);
    }

    @Override
    public void close() {
        closed = true;
        ScheduledTask task = sweepTask;
        if (task != null) {
            task.cancel();
        }
        entries.clear();
    }

    private static final class Entry<V> {
        final V value;
        final Instant expiresAt;

        Entry(V value, Instant expiresAt) {
            this.value = value;
            this.expiresAt = expiresAt;
        }

        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
