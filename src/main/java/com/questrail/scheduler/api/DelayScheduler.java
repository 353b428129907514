package com.questrail.scheduler.api;

import com.questrail.scheduler.time.MonotonicClock;

import java.time.Duration;
import java.util.Objects;

/**
 * DelayScheduler
 * =============================================================================
 * In-process scheduler that holds jobs until their due time and runs each
 * exactly once, unless it is cancelled first.
 *
 * <h2>Binding invariants</h2>
 * <ul>
 *   <li>Due times are expressed in ticks of {@link #clock()}; never in wall-clock instants.</li>
 *   <li>Among non-cancelled jobs, execution order is ascending due time, then
 *       ascending identifier, then submission order.</li>
 *   <li>A job never runs before {@link MonotonicClock#nowNanos()} reaches its due time.</li>
 * </ul>
 *
 * <p>All methods may be called from any thread.</p>
 */
public interface DelayScheduler
{
    /**
     * Queue {@code action} to run at or after {@code dueAtNanos}.
     *
     * @param id          opaque correlation token; duplicates are scheduled independently
     * @param action      work to run on the scheduler's worker thread
     * @param dueAtNanos  absolute due time in ticks of {@link #clock()}
     * @return handle usable to cancel the job while it is still queued
     */
    JobHandle schedule(long id, Runnable action, long dueAtNanos);

    /**
     * Convenience method: schedule {@code delay} after the scheduler clock's current value.
     * Delays beyond the clock's range saturate at {@link Long#MAX_VALUE}.
     */
    default JobHandle scheduleAfter(long id, Duration delay, Runnable action)
    {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(action, "action");

        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }

        long dueAt;
        try {
            dueAt = Math.addExact(clock().nowNanos(), delay.toNanos());
        } catch (ArithmeticException e) {
            // Too far away to express; saturate instead of wrapping into the past.
            dueAt = Long.MAX_VALUE;
        }
        return schedule(id, action, dueAt);
    }

    /**
     * Remove the handle's job if it is still queued. A stale handle, or a
     * handle whose job already started, is a silent no-op.
     *
     * @return {@code true} if the job was removed by this call
     */
    boolean cancel(JobHandle handle);

    /**
     * Point-in-time snapshot: {@code true} iff no job is currently queued.
     * Says nothing about jobs that may still be submitted.
     */
    boolean done();

    /**
     * Number of jobs currently queued.
     */
    int pendingCount();

    /**
     * The clock that due times are measured against.
     */
    MonotonicClock clock();
}
