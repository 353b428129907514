package com.questrail.scheduler.harness;

import com.questrail.scheduler.observability.Slf4jSchedulerObservabilitySink;

import java.time.Duration;

/**
 * Repeats timing runs and exits with status 255 on the first failure.
 *
 * <pre>
 *   TimingHarnessMain [runs] [jobs] [stepMillis] [toleranceMicros]
 *   defaults:            1    2048      500           600
 * </pre>
 *
 * Each job waits {@code (0..19) * stepMillis}.
 */
public final class TimingHarnessMain {

    static final int FAILURE_STATUS = 255;
    private static final int STEPS = 20;

    private TimingHarnessMain() {}

    public static void main(String[] args) throws Exception {
        System.exit(run(args));
    }

    static int run(String[] args) throws InterruptedException {
        final Options options;
        try {
            options = Options.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println("Usage: TimingHarnessMain [runs] [jobs] [stepMillis] [toleranceMicros]");
            return 1;
        }

        Duration step = Duration.ofMillis(options.stepMillis());
        Duration tolerance = Duration.ofNanos(options.toleranceMicros() * 1_000L);
        // Longest planned delay plus slack for a loaded machine.
        Duration drainTimeout = step.multipliedBy(STEPS).plusSeconds(5);
        TimingHarness harness = new TimingHarness(tolerance, drainTimeout, new Slf4jSchedulerObservabilitySink());

        for (int i = 1; i <= options.runs(); i++) {
            RandomJobPlan plan = RandomJobPlan.generate(System.nanoTime(), options.jobs(), step, STEPS);
            TimingReport report = harness.run(plan);
            if (!report.passed()) {
                System.out.println("Run " + i + " (seed " + plan.seed() + "): " + report.summary());
                return FAILURE_STATUS;
            }
            System.out.println("Run " + i + ": " + report.summary());
        }
        return 0;
    }

    record Options(int runs, int jobs, long stepMillis, long toleranceMicros) {

        static Options parse(String[] args) {
            int runs = args.length > 0 ? parsePositiveInt(args[0], "runs") : 1;
            int jobs = args.length > 1 ? parsePositiveInt(args[1], "jobs") : 2048;
            long stepMillis = args.length > 2 ? parsePositiveInt(args[2], "stepMillis") : 500;
            long toleranceMicros = args.length > 3 ? parsePositiveInt(args[3], "toleranceMicros") : 600;
            if (args.length > 4) {
                throw new IllegalArgumentException("Too many arguments: " + args.length);
            }
            return new Options(runs, jobs, stepMillis, toleranceMicros);
        }

        private static int parsePositiveInt(String raw, String name) {
            final int value;
            try {
                value = Integer.parseInt(raw.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(name + " must be an integer: " + raw, e);
            }
            if (value <= 0) {
                throw new IllegalArgumentException(name + " must be positive: " + raw);
            }
            return value;
        }
    }
}
