// com/owldsl/processing/ProcessingResult.java
package com.owldsl.processing;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Result container for batch rendering
 */
public class ProcessingResult {
    private final AtomicLong renderedClasses = new AtomicLong(0);
    private final AtomicLong failedClasses = new AtomicLong(0);
    private final AtomicLong writtenPrompts = new AtomicLong(0);
    private final AtomicLong explainedInferences = new AtomicLong(0);
    private double memoryUsedMB = 0.0;

    private final List<String> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();
    private long processingTimeMs;

    public long getRenderedClasses() {
        return renderedClasses.get();
    }

    public void incrementRenderedClasses() {
        renderedClasses.incrementAndGet();
    }

    public long getFailedClasses() {
        return failedClasses.get();
    }

    public void incrementFailedClasses() {
        failedClasses.incrementAndGet();
    }

    public long getWrittenPrompts() {
        return writtenPrompts.get();
    }

    public void addWrittenPrompts(long count) {
        writtenPrompts.addAndGet(count);
    }

    public long getExplainedInferences() {
        return explainedInferences.get();
    }

    public void addExplainedInferences(long count) {
        explainedInferences.addAndGet(count);
    }

    public double getMemoryUsedMB() {
        return memoryUsedMB;
    }

    public void setMemoryUsedMB(double memoryUsedMB) {
        this.memoryUsedMB = memoryUsedMB;
    }

    public List<String> getErrors() {
        return new ArrayList<>(errors);
    }

    public synchronized void addError(String error) {
        errors.add(error);
    }

    public List<String> getWarnings() {
        return new ArrayList<>(warnings);
    }

    public synchronized void addWarning(String warning) {
        warnings.add(warning);
    }

    public boolean isSuccess() {
        return errors.isEmpty();
    }

    public long getProcessingTimeMs() {
        return processingTimeMs;
    }

    public void setProcessingTimeMs(long processingTimeMs) {
        this.processingTimeMs = processingTimeMs;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public int getErrorCount() {
        return errors.size();
    }

    public int getWarningCount() {
        return warnings.size();
    }

    @Override
    public String toString() {
        return String.format("ProcessingResult{success=%s, rendered=%d, failed=%d, prompts=%d, " +
                        "inferences=%d, errors=%d, warnings=%d, timeMs=%d, memoryMB=%.2f}",
                isSuccess(), renderedClasses.get(), failedClasses.get(), writtenPrompts.get(),
                explainedInferences.get(), errors.size(), warnings.size(), processingTimeMs, memoryUsedMB);
    }
}
