package com.sbus.util;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Single control-flow thread on which all entity state is read and written.
 * Transport callbacks, timers and completions of application futures are
 * re-dispatched here, so no two callbacks of an entity run in parallel.
 */
public interface EventLoop {

    boolean inEventLoop();

    void execute(Runnable task);

    ScheduledTask schedule(Runnable task, Duration delay);

    /**
     * Current time as seen by the loop's timers.
     */
    Instant now();

    /**
     * Run {@code operation} on the loop and relay its outcome to the returned future.
     */
    default <T> CompletableFuture<T> submit(Supplier<CompletableFuture<T>> operation) {
        CompletableFuture<T> result = new CompletableFuture<>();
        Runnable task = () -> {
            CompletableFuture<T> started;
            try {
                started = operation.get();
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
                return;
            }
            started.whenComplete((value, error) -> {
                if (error != null) {
                    result.completeExceptionally(error);
                } else {
                    result.complete(value);
                }
            });
        };
        if (inEventLoop()) {
            task.run();
        } else {
            execute(task);
        }
        return result;
    }

    /**
     * A future completed like {@code source}, with the completion delivered on the loop.
     */
    default <T> CompletableFuture<T> relay(CompletableFuture<T> source) {
        CompletableFuture<T> target = new CompletableFuture<>();
        source.whenComplete((value, error) -> execute(() -> {
            if (error != null) {
                target.completeExceptionally(error);
            } else {
                target.complete(value);
            }
        }));
        return target;
    }
}
