package com.questrail.scheduler.harness;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Seeded list of jobs for a timing run.
 *
 * <p>Each job waits a whole number of {@code step}s, drawn uniformly from
 * {@code [0, steps)}, and is cancelled right after scheduling with probability
 * 65/255.</p>
 */
public final class RandomJobPlan {

    /** Draws in {@code [0, 255)} at or below this value mark a job for cancellation. */
    static final int CANCEL_THRESHOLD = 64;

    private final long seed;
    private final List<PlannedJob> jobs;

    private RandomJobPlan(long seed, List<PlannedJob> jobs) {
        this.seed = seed;
        this.jobs = Collections.unmodifiableList(jobs);
    }

    public static RandomJobPlan generate(long seed, int jobCount, Duration step, int steps) {
        Objects.requireNonNull(step, "step");
        if (jobCount < 0) {
            throw new IllegalArgumentException("jobCount must be >= 0");
        }
        if (step.isNegative()) {
            throw new IllegalArgumentException("step must be >= 0");
        }
        if (steps <= 0) {
            throw new IllegalArgumentException("steps must be positive");
        }

        Random random = new Random(seed);
        List<PlannedJob> jobs = new ArrayList<>(jobCount);
        for (int i = 0; i < jobCount; i++) {
            Duration delay = step.multipliedBy(random.nextInt(steps));
            boolean cancel = random.nextInt(255) <= CANCEL_THRESHOLD;
            jobs.add(new PlannedJob(i, delay, cancel));
        }
        return new RandomJobPlan(seed, jobs);
    }

    public long seed() {
        return seed;
    }

    public List<PlannedJob> jobs() {
        return jobs;
    }

    public int size() {
        return jobs.size();
    }

    /**
     * One planned job: identifier, delay from submission, and whether the
     * harness cancels it immediately.
     */
    public record PlannedJob(long id, Duration delay, boolean cancel) {
        public PlannedJob {
            Objects.requireNonNull(delay, "delay");
        }
    }
}
