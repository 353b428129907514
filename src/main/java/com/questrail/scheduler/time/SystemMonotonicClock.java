package com.questrail.scheduler.time;

/**
 * SystemMonotonicClock
 * =============================================================================
 * Production {@link MonotonicClock} implementation backed by {@link System#nanoTime()}.
 *
 * <h2>Properties</h2>
 * <ul>
 *   <li>Monotonically non-decreasing (never goes backward)</li>
 *   <li>Not affected by wall-clock adjustments (NTP, DST, manual changes)</li>
 *   <li>{@link #advance(java.time.Duration)} is a no-op</li>
 * </ul>
 *
 * <p>For deterministic testing, use {@link ManualMonotonicClock} instead.</p>
 */
public enum SystemMonotonicClock implements MonotonicClock {
    /**
     * Singleton instance.
     */
    INSTANCE;

    @Override
    public long nowNanos() {
        return System.nanoTime();
    }
}
