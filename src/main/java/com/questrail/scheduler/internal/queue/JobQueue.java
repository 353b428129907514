package com.questrail.scheduler.internal.queue;

import java.util.ArrayList;
import java.util.List;
import java.util.NavigableSet;
import java.util.Objects;
import java.util.TreeSet;

/**
 * JobQueue
 * =============================================================================
 * Pending jobs ordered by {@link ScheduledJob#EXECUTION_ORDER}.
 *
 * <p>Iteration front-to-back yields non-decreasing due times. Insert, remove
 * and pop are O(log n); peek is O(log n) on the backing tree.</p>
 *
 * <h2>Thread Safety</h2>
 * <p>Not thread-safe. The owning scheduler calls every method while holding
 * its queue lock.</p>
 */
public final class JobQueue {

    private final NavigableSet<ScheduledJob> jobs = new TreeSet<>(ScheduledJob.EXECUTION_ORDER);

    /**
     * @throws IllegalStateException if the same job instance is already queued
     */
    public void insert(ScheduledJob job) {
        Objects.requireNonNull(job, "job");
        if (!jobs.add(job)) {
            throw new IllegalStateException("Job already queued: " + job);
        }
    }

    /**
     * @return the earliest job, or {@code null} if the queue is empty
     */
    public ScheduledJob peekEarliest() {
        return jobs.isEmpty() ? null : jobs.first();
    }

    /**
     * @return the earliest job after removing it, or {@code null} if the queue is empty
     */
    public ScheduledJob popEarliest() {
        return jobs.pollFirst();
    }

    /**
     * @return {@code true} if {@code job} was queued and has been removed
     */
    public boolean remove(ScheduledJob job) {
        Objects.requireNonNull(job, "job");
        return jobs.remove(job);
    }

    public boolean isEmpty() {
        return jobs.isEmpty();
    }

    public int size() {
        return jobs.size();
    }

    /**
     * Removes every queued job and returns them in execution order.
     */
    public List<ScheduledJob> drain() {
        List<ScheduledJob> drained = new ArrayList<>(jobs);
        jobs.clear();
        return drained;
    }
}
