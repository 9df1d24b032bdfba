package com.umitunal.qdispatch.core;

import java.util.Objects;

/**
 * Immutable audit entry for one finished attempt, keyed by {@code (jobId, attempt)}.
 *
 * @param jobId         job the attempt belongs to
 * @param attempt       attempt number, starting at 1
 * @param workerId      worker that held the lease
 * @param startedAt     lease grant time, millis since epoch
 * @param finishedAt    settlement time, millis since epoch
 * @param outcome       how the attempt ended
 * @param resultOrError result message on success, error message otherwise; may be null
 */
public record ExecutionRecord(
    String jobId,
    int attempt,
    String workerId,
    long startedAt,
    long finishedAt,
    Outcome outcome,
    String resultOrError
) {

    public ExecutionRecord {
        Objects.requireNonNull(jobId, "jobId");
        Objects.requireNonNull(outcome, "outcome");
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be at least 1: " + attempt);
        }
    }

    public long durationMillis() {
        return Math.max(0, finishedAt - startedAt);
    }

    public enum Outcome {
        SUCCESS,
        FAILURE,
        TIMEOUT
    }
}
