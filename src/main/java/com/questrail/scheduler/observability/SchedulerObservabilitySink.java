package com.questrail.scheduler.observability;

/**
 * Main interface for receiving scheduler observability events.
 * Implementations can provide logging, metrics, or test recording.
 *
 * <p>Callbacks are never invoked while the scheduler's queue lock is held.
 * Execution and failure callbacks run on the worker thread.</p>
 */
public interface SchedulerObservabilitySink {
    /**
     * Called after a job has been queued.
     * @param event the scheduled job
     */
    void onJobScheduled(JobScheduledEvent event);

    /**
     * Called after a queued job has been removed by cancellation.
     * @param event the cancelled job
     */
    void onJobCancelled(JobCancelledEvent event);

    /**
     * Called after a job's action returned normally.
     * @param event execution timings
     */
    void onJobExecuted(JobExecutedEvent event);

    /**
     * Called after a job's action threw. The worker keeps dispatching.
     * @param event the failure
     */
    void onJobFailed(JobFailedEvent event);

    /**
     * Called when the worker thread starts or terminates.
     * @param event the lifecycle transition
     */
    void onLifecycle(SchedulerLifecycleEvent event);
}
