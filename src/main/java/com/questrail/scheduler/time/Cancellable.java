package com.questrail.scheduler.time;

/**
 * Cancellable
 * =============================================================================
 * Minimal cancellation handle for scheduled work.
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the scheduled work.
     *
     * @return {@code true} if this call cancelled work that had not started;
     *         {@code false} if the work already started, already finished, or
     *         was previously cancelled.
     */
    boolean cancel();
}
