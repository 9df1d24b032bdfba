package com.umitunal.qdispatch.worker;

import com.umitunal.qdispatch.core.Job;

import java.util.concurrent.CancellationException;

/**
 * What a {@link JobHandler} sees of the attempt it is running, including the cooperative
 * cancellation flag.
 *
 * @param <T> the type of job payload
 */
public final class JobContext<T> {
    private final Job<T> job;
    private final String workerId;
    private final int attempt;
    private volatile boolean cancelled;

    public JobContext(Job<T> job, String workerId) {
        this.job = job;
        this.workerId = workerId;
        this.attempt = job.getCurrentAttempt();
    }

    public Job<T> job() {
        return job;
    }

    public String jobId() {
        return job.getId();
    }

    public T payload() {
        return job.getPayload();
    }

    public String workerId() {
        return workerId;
    }

    public int attempt() {
        return attempt;
    }

    public boolean isCancelled() {
        return cancelled || Thread.currentThread().isInterrupted();
    }

    /**
     * Convenience for handlers that prefer to bail out with an exception.
     */
    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new CancellationException("Execution of job " + job.getId() + " was cancelled");
        }
    }

    /**
     * Raise the cancellation flag. Called by the supervisor when the deadline passes.
     */
    public void cancel() {
        this.cancelled = true;
    }
}
