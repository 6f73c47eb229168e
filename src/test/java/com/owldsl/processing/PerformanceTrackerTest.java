package com.owldsl.processing;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PerformanceTrackerTest {

    @Test
    void testDurationsAccumulate() {
        PerformanceTracker tracker = new PerformanceTracker();

        long first = tracker.end("render");
        tracker.start("render");
        long second = tracker.end("render");
        tracker.start("export");
        tracker.end("export");

        assertEquals(0, first);
        assertEquals(second, tracker.getDuration("render"));
        assertEquals(2, tracker.getDurations().size());
        assertEquals(tracker.getDuration("render") + tracker.getDuration("export"), tracker.getTotalDuration());

        tracker.clear();
        assertEquals(0, tracker.getTotalDuration());
    }
}
