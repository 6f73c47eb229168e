// com/owldsl/processing/PerformanceTracker.java
package com.owldsl.processing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Wall-clock timing of named processing phases
 */
public class PerformanceTracker {
    private static final Logger LOGGER = LoggerFactory.getLogger(PerformanceTracker.class);

    private final Map<String, Long> startTimes = new ConcurrentHashMap<>();
    private final Map<String, Long> durations = new ConcurrentHashMap<>();

    public void start(String phase) {
        startTimes.put(phase, System.currentTimeMillis());
        LOGGER.debug("Started phase: {}", phase);
    }

    /**
     * End a phase started with {@link #start(String)}; repeated phases accumulate
     */
    public long end(String phase) {
        Long startTime = startTimes.remove(phase);
        if (startTime == null) {
            LOGGER.warn("No start time found for phase: {}", phase);
            return 0L;
        }
        long duration = System.currentTimeMillis() - startTime;
        durations.merge(phase, duration, Long::sum);
        LOGGER.debug("Completed phase '{}' in {} ms", phase, duration);
        return duration;
    }

    public long getDuration(String phase) {
        return durations.getOrDefault(phase, 0L);
    }

    public long getTotalDuration() {
        return durations.values().stream().mapToLong(Long::longValue).sum();
    }

    public Map<String, Long> getDurations() {
        return new LinkedHashMap<>(durations);
    }

    public void logSummary() {
        LOGGER.info("=== Performance Summary ===");
        durations.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed())
                .forEach(entry -> LOGGER.info("{}: {} ms", entry.getKey(), entry.getValue()));
        LOGGER.info("Total tracked time: {} ms", getTotalDuration());
    }

    public void clear() {
        startTimes.clear();
        durations.clear();
    }
}
