package com.questrail.scheduler.observability;

import java.time.Instant;

/**
 * Record representing a completed job execution.
 *
 * <p>All {@code *Nanos} values are ticks of the scheduler's monotonic clock.
 * {@code startedAtNanos} is the clock value observed when the worker
 * dispatched the job.</p>
 */
public record JobExecutedEvent(
    Instant timestamp,
    long jobId,
    long dueAtNanos,
    long startedAtNanos,
    long finishedAtNanos
) {
    /**
     * How long after its due time the job started. Never negative for a
     * monotonic clock.
     */
    public long latenessNanos() {
        return startedAtNanos - dueAtNanos;
    }

    public long durationNanos() {
        return finishedAtNanos - startedAtNanos;
    }
}
