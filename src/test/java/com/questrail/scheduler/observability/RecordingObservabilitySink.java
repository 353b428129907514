package com.questrail.scheduler.observability;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements SchedulerObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onJobScheduled(JobScheduledEvent event) {
        record(event);
    }

    @Override
    public synchronized void onJobCancelled(JobCancelledEvent event) {
        record(event);
    }

    @Override
    public synchronized void onJobExecuted(JobExecutedEvent event) {
        record(event);
    }

    @Override
    public synchronized void onJobFailed(JobFailedEvent event) {
        record(event);
    }

    @Override
    public synchronized void onLifecycle(SchedulerLifecycleEvent event) {
        record(event);
    }

    private void record(Object event) {
        events.add(event);
        notifyAll();
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized <T> List<T> eventsOfType(Class<T> type) {
        return events.stream()
            .filter(type::isInstance)
            .map(type::cast)
            .collect(Collectors.toList());
    }

    public List<JobExecutedEvent> getExecutions() {
        return eventsOfType(JobExecutedEvent.class);
    }

    public List<Long> executedIds() {
        return getExecutions().stream()
            .map(JobExecutedEvent::jobId)
            .collect(Collectors.toList());
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }

    /**
     * Blocks until at least {@code count} events of {@code type} have been recorded.
     *
     * @return {@code true} if the count was reached before the timeout
     */
    public <T> boolean awaitEvents(Class<T> type, int count, Duration timeout) throws InterruptedException {
        return awaitCondition(all -> all.stream().filter(type::isInstance).count() >= count, timeout);
    }

    public synchronized boolean awaitCondition(Predicate<List<Object>> condition, Duration timeout)
            throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!condition.test(events)) {
            long remainingMillis = (deadline - System.nanoTime()) / 1_000_000L;
            if (remainingMillis <= 0) {
                return false;
            }
            wait(remainingMillis);
        }
        return true;
    }
}
