package com.questrail.scheduler.observability;

import java.time.Instant;

/**
 * Record representing a queued job removed before dispatch.
 */
public record JobCancelledEvent(
    Instant timestamp,
    long jobId,
    long dueAtNanos
) {
}
