package com.questrail.scheduler.api;

/**
 * Lifecycle of a scheduled job as observed through its {@link JobHandle}.
 *
 * <pre>
 *   PENDING ──cancel()──▶ CANCELLED
 *      │
 *      └──dispatch──▶ RUNNING ──▶ COMPLETED | FAILED
 * </pre>
 */
public enum JobState {
    /** Queued and waiting for its due time. */
    PENDING,
    /** Dequeued by the worker; its action is executing. */
    RUNNING,
    /** Action returned normally. */
    COMPLETED,
    /** Action threw; the failure was reported to the observability sink. */
    FAILED,
    /** Removed from the queue before it was dispatched. */
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
