package com.sbus.util;

import io.netty.util.concurrent.DefaultEventExecutor;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.EventExecutor;
import io.netty.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

/**
 * {@link EventLoop} backed by a single-threaded Netty event executor.
 */
public class NettyEventLoop implements EventLoop, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(NettyEventLoop.class);

    private final EventExecutor executor;
    private final boolean owned;

    public NettyEventLoop() {
        this(new DefaultEventExecutor(new DefaultThreadFactory("sbus-event-loop", true)), true);
    }

    public NettyEventLoop(EventExecutor executor) {
        this(executor, false);
    }

    private NettyEventLoop(EventExecutor executor, boolean owned) {
        this.executor = executor;
        this.owned = owned;
    }

    @Override
    public boolean inEventLoop() {
        return executor.inEventLoop();
    }

    @Override
    public void execute(Runnable task) {
        executor.execute(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("Unhandled error in event loop task", e);
            }
        });
    }

    @Override
    public ScheduledTask schedule(Runnable task, Duration delay) {
        long millis = Math.max(0, delay.toMillis());
        ScheduledFuture<?> future = executor.schedule(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("Unhandled error in scheduled task", e);
            }
        }, millis, TimeUnit.MILLISECONDS);
        return new ScheduledTask() {
            @Override
            public boolean cancel() {
                return future.cancel(false);
            }

            @Override
            public boolean isCancelled() {
                return future.isCancelled();
            }
        };
    }

    @Override
    public Instant now() {
        return Instant.now();
    }

    public boolean isShuttingDown() {
        return executor.isShuttingDown();
    }

    /**
     * Shut the executor down if this loop created it.
     */
    @Override
    public void close() {
        if (!owned) {
            return;
        }
        if (executor.inEventLoop()) {
            // Cannot wait for our own thread to terminate
            executor.shutdownGracefully(0, 5, TimeUnit.SECONDS);
            return;
        }
        executor.shutdownGracefully(0, 5, TimeUnit.SECONDS).syncUninterruptibly();
        log.debug("Event loop shut down");
    }
}
