package com.sbus.retry;

import com.sbus.errors.ErrorTranslator;
import com.sbus.errors.MessagingException;
import com.sbus.util.EventLoop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * Bounded-attempt retry of an asynchronous operation.
 *
 * Every failure is translated first; a non-retryable error ends the retry at
 * once, a retryable one is retried after the configured delay until the attempts
 * are used up. The returned future fails with the last translated error.
 */
public final class Retry {

    private static final Logger log = LoggerFactory.getLogger(Retry.class);

    private Retry() {
    }

    public static <T> CompletableFuture<T> retry(RetryConfig<T> config, EventLoop eventLoop) {
        CompletableFuture<T> result = new CompletableFuture<>();
        eventLoop.execute(() -> attempt(config, eventLoop, 1, result));
        return result;
    }

    private static <T> void attempt(RetryConfig<T> config, EventLoop eventLoop, int attempt,
                                    CompletableFuture<T> result) {
        String connectionId = config.getConnectionId();
        CompletableFuture<T> operation;
        try {
            operation = config.getOperation().get();
        } catch (RuntimeException e) {
            operation = CompletableFuture.failedFuture(e);
        }
        operation.whenComplete((value, error) -> eventLoop.execute(() -> {
            if (error == null) {
                if (attempt > 1) {
                    log.debug("[{}] Operation '{}' succeeded on attempt {}.",
                            connectionId, config.getOperationType(), attempt);
                }
                result.complete(value);
                return;
            }
            MessagingException translated = ErrorTranslator.translate(error);
            if (!translated.isRetryable()) {
                log.warn("[{}] Operation '{}' failed on attempt {} with a non-retryable error: {}",
                        connectionId, config.getOperationType(), attempt, translated.toString());
                result.completeExceptionally(translated);
                return;
            }
            if (attempt >= config.getTimes()) {
                log.error("[{}] Operation '{}' failed after {} attempts. Last error: {}",
                        connectionId, config.getOperationType(), attempt, translated.toString());
                result.completeExceptionally(translated);
                return;
            }
            log.warn("[{}] Attempt {} of '{}' failed with a retryable error, retrying in {} ms: {}",
                    connectionId, attempt, config.getOperationType(), config.getDelay().toMillis(),
                    translated.getMessage());
            eventLoop.schedule(() -> attempt(config, eventLoop, attempt + 1, result), config.getDelay());
        }));
    }
}
