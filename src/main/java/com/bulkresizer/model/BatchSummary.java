package com.bulkresizer.model;

import java.util.List;

/**
 * Aggregate result of one batch run.
 */
public final class BatchSummary {

    private final List<JobOutcome> outcomes;
    private final long elapsedMs;

    public BatchSummary(List<JobOutcome> outcomes, long elapsedMs) {
        this.outcomes = List.copyOf(outcomes);
        this.elapsedMs = elapsedMs;
    }

    public List<JobOutcome> getOutcomes() {
        return outcomes;
    }

    public int getTotal() {
        return outcomes.size();
    }

    public int getSucceeded() {
        return (int) outcomes.stream().filter(JobOutcome::isSuccess).count();
    }

    public int getFailed() {
        return getTotal() - getSucceeded();
    }

    public List<JobOutcome> getFailures() {
        return outcomes.stream()
                .filter(o -> !o.isSuccess())
                .toList();
    }

    public long getElapsedMs() {
        return elapsedMs;
    }

    @Override
    public String toString() {
        return "BatchSummary{total=" + getTotal() + ", succeeded=" + getSucceeded()
                + ", failed=" + getFailed() + ", elapsedMs=" + elapsedMs + "}";
    }
}
