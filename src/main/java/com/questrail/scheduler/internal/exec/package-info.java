/**
 * Dispatch worker for the delay scheduler.
 *
 * <p>{@link com.questrail.scheduler.internal.exec.SingleThreadDelayScheduler}
 * owns the {@link com.questrail.scheduler.internal.queue.JobQueue}, the queue
 * lock and the single worker thread:</p>
 *
 * <pre>
 *   producer threads ── schedule / cancel ──▶ JobQueue (under queueLock)
 *                                               │  signal
 *                                               ▼
 *   worker thread   ◀── timed wait ── earliest due time | wake-up
 *        │
 *        └── action.run() with queueLock released
 *                 → JobExecutedEvent | JobFailedEvent
 * </pre>
 *
 * <p>Handles returned to callers are weak: the scheduler alone decides how
 * long a job lives.</p>
 */
package com.questrail.scheduler.internal.exec;
