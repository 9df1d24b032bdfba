package com.umitunal.qdispatch.core;

/**
 * Represents a unit of work to be executed by the queue system.
 *
 * @param <T> the type of the job payload
 */
public interface Job<T> {

    /**
     * Gets the unique identifier for this job.
     */
    String getId();

    /**
     * Gets the job payload data.
     */
    T getPayload();

    /**
     * Gets the current lifecycle state.
     */
    JobState getState();

    /**
     * Number of finished attempts, whether they succeeded, failed or lost their lease.
     */
    int getAttempts();

    /**
     * Gets the maximum number of execution attempts allowed.
     */
    int getMaxAttempts();

    /**
     * Attempt number of the execution that the current (or next) lease runs, starting at 1.
     */
    default int getCurrentAttempt() {
        return getAttempts() + 1;
    }

    /**
     * Enqueue time in milliseconds since epoch.
     */
    long getEnqueuedAt();

    /**
     * Earliest dispatch time in milliseconds since epoch.
     */
    long getEligibleAt();

    /**
     * Per-job execution deadline in milliseconds, or 0 to use the engine default.
     */
    long getTimeoutMillis();

    /**
     * Error message of the most recent failed attempt, or null.
     */
    String getLastError();

    /**
     * The lease held on this job, or null unless the job is {@link JobState#ACTIVE}.
     */
    Lease getLease();

    /**
     * Checks if another attempt is allowed.
     */
    default boolean canRetry() {
        return getAttempts() < getMaxAttempts();
    }
}
