package com.questrail.scheduler.harness;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TimingHarnessMainTest {

    @Test
    void parsesDefaults() {
        TimingHarnessMain.Options options = TimingHarnessMain.Options.parse(new String[0]);

        assertEquals(new TimingHarnessMain.Options(1, 2048, 500, 600), options);
    }

    @Test
    void parsesExplicitValues() {
        TimingHarnessMain.Options options = TimingHarnessMain.Options.parse(new String[] {"3", "64", "2", "50000"});

        assertEquals(new TimingHarnessMain.Options(3, 64, 2, 50_000), options);
    }

    @Test
    void rejectsMalformedArguments() {
        assertThrows(IllegalArgumentException.class, () -> TimingHarnessMain.Options.parse(new String[] {"x"}));
        assertThrows(IllegalArgumentException.class, () -> TimingHarnessMain.Options.parse(new String[] {"0"}));
        assertThrows(IllegalArgumentException.class,
                () -> TimingHarnessMain.Options.parse(new String[] {"1", "1", "1", "1", "1"}));
    }

    @Test
    void shortRunExitsWithZero() throws InterruptedException {
        assertEquals(0, TimingHarnessMain.run(new String[] {"2", "32", "2", "50000"}));
    }

    @Test
    void usageErrorExitsWithOne() throws InterruptedException {
        assertEquals(1, TimingHarnessMain.run(new String[] {"nope"}));
    }
}
