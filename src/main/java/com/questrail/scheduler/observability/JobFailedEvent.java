package com.questrail.scheduler.observability;

import java.time.Instant;

/**
 * Record representing a job whose action threw.
 */
public record JobFailedEvent(
    Instant timestamp,
    long jobId,
    long dueAtNanos,
    long startedAtNanos,
    Throwable cause
) {
}
