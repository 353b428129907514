package com.questrail.scheduler.time;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ManualMonotonicClockTest {

    @Test
    void startsAtGivenBaseAndOnlyMovesWhenAdvanced() throws InterruptedException {
        ManualMonotonicClock clock = new ManualMonotonicClock(1_000L);

        Thread.sleep(5);
        assertEquals(1_000L, clock.nowNanos());

        clock.advanceNanos(500L);
        assertEquals(1_500L, clock.nowNanos());

        clock.advanceMillis(2);
        assertEquals(2_001_500L, clock.nowNanos());

        clock.advance(Duration.ofNanos(10));
        assertEquals(2_001_510L, clock.nowNanos());
    }

    @Test
    void defaultBaseIsTheRealMonotonicTime() {
        long before = System.nanoTime();
        ManualMonotonicClock clock = new ManualMonotonicClock();
        long after = System.nanoTime();

        assertTrue(clock.nowNanos() >= before);
        assertTrue(clock.nowNanos() <= after);
    }

    @Test
    void rejectsBackwardsMovement() {
        ManualMonotonicClock clock = new ManualMonotonicClock(100L);

        assertThrows(IllegalArgumentException.class, () -> clock.advanceNanos(-1));
        assertThrows(IllegalArgumentException.class, () -> clock.advance(Duration.ofMillis(-1)));
        assertThrows(IllegalArgumentException.class, () -> clock.advanceTo(99L));
        assertEquals(100L, clock.nowNanos());
    }

    @Test
    void advanceToMovesToAbsoluteValue() {
        ManualMonotonicClock clock = new ManualMonotonicClock(100L);

        clock.advanceTo(100L);
        assertEquals(100L, clock.nowNanos());

        clock.advanceTo(250L);
        assertEquals(250L, clock.nowNanos());
    }

    @Test
    void listenersRunAfterEveryAdvanceAndCanBeRemoved() {
        ManualMonotonicClock clock = new ManualMonotonicClock(0L);
        List<Long> observed = new ArrayList<>();
        Runnable listener = () -> observed.add(clock.nowNanos());

        clock.addAdvanceListener(listener);
        clock.advanceNanos(5);
        clock.advanceTo(20);
        clock.removeAdvanceListener(listener);
        clock.advanceNanos(5);

        assertEquals(List.of(5L, 20L), observed);
    }

    @Test
    void concurrentAdvancesAreNeverLost() throws InterruptedException {
        ManualMonotonicClock clock = new ManualMonotonicClock(0L);
        int threads = 8;
        int advancesPerThread = 1_000;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch startGate = new CountDownLatch(1);
        AtomicInteger finished = new AtomicInteger();

        try {
            for (int t = 0; t < threads; t++) {
                pool.execute(() -> {
                    try {
                        startGate.await();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return;
                    }
                    for (int i = 0; i < advancesPerThread; i++) {
                        clock.advanceNanos(1);
                    }
                    finished.incrementAndGet();
                });
            }
            startGate.countDown();
        } finally {
            pool.shutdown();
            assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));
        }

        assertEquals(threads, finished.get());
        assertEquals((long) threads * advancesPerThread, clock.nowNanos());
    }
}
