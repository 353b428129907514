package com.questrail.scheduler.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Fans every event out to a fixed list of sinks, in order.
 * A sink that throws is logged and skipped; later sinks still see the event.
 */
public final class CompositeSchedulerObservabilitySink implements SchedulerObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(CompositeSchedulerObservabilitySink.class);

    private final List<SchedulerObservabilitySink> sinks;

    public CompositeSchedulerObservabilitySink(SchedulerObservabilitySink... sinks) {
        this(List.of(sinks));
    }

    public CompositeSchedulerObservabilitySink(List<SchedulerObservabilitySink> sinks) {
        Objects.requireNonNull(sinks, "sinks");
        this.sinks = List.copyOf(sinks);
    }

    @Override
    public void onJobScheduled(JobScheduledEvent event) {
        forEachSink(sink -> sink.onJobScheduled(event));
    }

    @Override
    public void onJobCancelled(JobCancelledEvent event) {
        forEachSink(sink -> sink.onJobCancelled(event));
    }

    @Override
    public void onJobExecuted(JobExecutedEvent event) {
        forEachSink(sink -> sink.onJobExecuted(event));
    }

    @Override
    public void onJobFailed(JobFailedEvent event) {
        forEachSink(sink -> sink.onJobFailed(event));
    }

    @Override
    public void onLifecycle(SchedulerLifecycleEvent event) {
        forEachSink(sink -> sink.onLifecycle(event));
    }

    private void forEachSink(Consumer<SchedulerObservabilitySink> call) {
        for (SchedulerObservabilitySink sink : sinks) {
            try {
                call.accept(sink);
            } catch (RuntimeException e) {
                log.warn("Observability sink {} threw; continuing with remaining sinks", sink, e);
            }
        }
    }
}
