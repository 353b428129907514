package com.questrail.scheduler.observability;

import java.time.Instant;

/**
 * Record representing a job entering the queue.
 */
public record JobScheduledEvent(
    Instant timestamp,
    long jobId,
    long dueAtNanos
) {
}
