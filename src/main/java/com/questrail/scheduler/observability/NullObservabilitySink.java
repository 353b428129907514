package com.questrail.scheduler.observability;

/**
 * No-op implementation of SchedulerObservabilitySink.
 */
public final class NullObservabilitySink implements SchedulerObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onJobScheduled(JobScheduledEvent event) {}

    @Override
    public void onJobCancelled(JobCancelledEvent event) {}

    @Override
    public void onJobExecuted(JobExecutedEvent event) {}

    @Override
    public void onJobFailed(JobFailedEvent event) {}

    @Override
    public void onLifecycle(SchedulerLifecycleEvent event) {}
}
