package com.bulkresizer.model;

/**
 * Terminal state of a single {@link ResizeJob}.
 */
public final class JobOutcome {

    public enum Status {
        SUCCESS, FAILED
    }

    /** Stage at which a failed job stopped */
    public enum FailureKind {
        DECODE, TRANSFORM, ENCODE
    }

    private final ResizeJob job;
    private final Status status;
    private final FailureKind failureKind;
    private final String errorMessage;
    private final long durationMs;

    private JobOutcome(ResizeJob job, Status status, FailureKind failureKind, String errorMessage, long durationMs) {
        this.job = job;
        this.status = status;
        this.failureKind = failureKind;
        this.errorMessage = errorMessage;
        this.durationMs = durationMs;
    }

    public static JobOutcome success(ResizeJob job, long durationMs) {
        return new JobOutcome(job, Status.SUCCESS, null, null, durationMs);
    }

    public static JobOutcome failure(ResizeJob job, FailureKind kind, String errorMessage, long durationMs) {
        return new JobOutcome(job, Status.FAILED, kind, errorMessage, durationMs);
    }

    public ResizeJob getJob() {
        return job;
    }

    public Status getStatus() {
        return status;
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    /** Null for successful jobs */
    public FailureKind getFailureKind() {
        return failureKind;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public long getDurationMs() {
        return durationMs;
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "SUCCESS " + job.getSourcePath()
                : "FAILED(" + failureKind + ") " + job.getSourcePath() + ": " + errorMessage;
    }
}
