package com.sbus.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Parameters of one retried operation.
 */
public class RetryConfig<T> {

    public static final int DEFAULT_RETRY_ATTEMPTS = 3;
    public static final int DEFAULT_CONNECTION_RETRY_ATTEMPTS = 150;
    public static final Duration DEFAULT_DELAY_BETWEEN_RETRIES = Duration.ofSeconds(5);

    private final Supplier<CompletableFuture<T>> operation;
    private final String connectionId;
    private final RetryOperationType operationType;
    private int times = DEFAULT_RETRY_ATTEMPTS;
    private Duration delay = DEFAULT_DELAY_BETWEEN_RETRIES;

    public RetryConfig(Supplier<CompletableFuture<T>> operation, String connectionId,
                       RetryOperationType operationType) {
        this.operation = Objects.requireNonNull(operation, "operation");
        this.connectionId = connectionId;
        this.operationType = Objects.requireNonNull(operationType, "operationType");
    }

    public Supplier<CompletableFuture<T>> getOperation() {
        return operation;
    }

    public String getConnectionId() {
        return connectionId;
    }

    public RetryOperationType getOperationType() {
        return operationType;
    }

    /**
     * Maximum number of attempts, the first one included.
     */
    public int getTimes() {
        return times;
    }

    public RetryConfig<T> setTimes(int times) {
        if (times < 1) {
            throw new IllegalArgumentException("times must be at least 1: " + times);
        }
        this.times = times;
        return this;
    }

    public Duration getDelay() {
        return delay;
    }

    public RetryConfig<T> setDelay(Duration delay) {
        if (delay == null || delay.isNegative()) {
            throw new IllegalArgumentException("delay must not be negative: " + delay);
        }
        this.delay = delay;
        return this;
    }
}
