package com.spatialflow.scheduling;

/**
 * Handle to a pending one-shot task.
 */
public interface ScheduledTask {

    /**
     * Prevents the task from running if it has not started yet. Safe to call twice.
     */
    void cancel();
}
