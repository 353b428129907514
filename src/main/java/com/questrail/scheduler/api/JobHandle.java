package com.questrail.scheduler.api;

import com.questrail.scheduler.time.Cancellable;

/**
 * JobHandle
 * =============================================================================
 * Non-owning reference to a job returned by {@link DelayScheduler#schedule}.
 *
 * <p>
 * The scheduler exclusively owns the job. A handle never keeps the job's
 * action reachable once the scheduler has executed or discarded it, and every
 * operation on such a stale handle is safe: {@link #cancel()} simply returns
 * {@code false}.
 * </p>
 */
public interface JobHandle extends Cancellable
{
    /**
     * Caller-supplied identifier. Not required to be unique.
     */
    long id();

    /**
     * Absolute due time in the scheduler clock's nanoseconds.
     */
    long dueAtNanos();

    /**
     * Current lifecycle state of the job.
     */
    JobState state();

    /**
     * Cancels the job if it is still queued. Never interrupts or waits for a
     * job that has already started.
     *
     * @return {@code true} only for the call that removed the job from the queue
     */
    @Override
    boolean cancel();
}
