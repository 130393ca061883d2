package com.sbus.util;

public interface ScheduledTask {

    /**
     * Cancel the task if it has not run yet.
     *
     * @return true if this call prevented the task from running
     */
    boolean cancel();

    boolean isCancelled();
}
