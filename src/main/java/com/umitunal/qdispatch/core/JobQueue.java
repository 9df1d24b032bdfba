package com.umitunal.qdispatch.core;

import com.umitunal.qdispatch.exception.DuplicateJobException;
import com.umitunal.qdispatch.exception.LeaseExpiredException;
import com.umitunal.qdispatch.exception.NotOwnerException;
import com.umitunal.qdispatch.exception.QueueDrainingException;
import com.umitunal.qdispatch.exception.QueueException;
import com.umitunal.qdispatch.exception.UnknownJobException;

import java.util.Optional;

/**
 * Durable job queue with leased, exactly-once dispatch and at-least-once delivery.
 *
 * <p>A job may run more than once if its worker crashes, but never concurrently under two valid leases.
 *
 * @param <T> the type of job payload
 */
public interface JobQueue<T> {

    /**
     * Enqueue a job under a generated id.
     *
     * @return the new job id
     * @throws QueueDrainingException if the queue no longer accepts jobs
     */
    String enqueue(T payload, EnqueueOptions options) throws QueueException;

    /**
     * Enqueue a job under a caller-chosen id.
     *
     * @throws DuplicateJobException if a job with this id exists
     */
    void enqueue(String jobId, T payload, EnqueueOptions options) throws QueueException;

    /**
     * Atomically claim the next eligible job. At most one caller receives any given job.
     *
     * @param workerId      unique identifier for the worker
     * @param leaseDuration how long the worker can hold the job (milliseconds)
     * @return the leased job, or null if none is eligible
     */
    Job<T> claim(String workerId, long leaseDuration) throws QueueException;

    /**
     * Mark a leased job as completed.
     *
     * @throws LeaseExpiredException if the caller's lease expired or was revoked
     * @throws NotOwnerException if another worker holds the lease
     * @throws UnknownJobException if the job does not exist
     */
    void ack(String jobId, String workerId, String result) throws QueueException;

    default void ack(String jobId, String workerId) throws QueueException {
        ack(jobId, workerId, null);
    }

    /**
     * Record a failed attempt and reschedule the job with backoff, or fail it once attempts run out.
     */
    RetryDecision nack(String jobId, String workerId, String error, ExecutionRecord.Outcome outcome)
            throws QueueException;

    default RetryDecision nack(String jobId, String workerId, String error) throws QueueException {
        return nack(jobId, workerId, error, ExecutionRecord.Outcome.FAILURE);
    }

    /**
     * Push the lease expiry to {@code now + duration}.
     */
    void extendLease(String jobId, String workerId, long duration) throws QueueException;

    /**
     * Move DELAYED jobs whose time has come to WAITING.
     *
     * @return number of jobs promoted
     */
    long promoteDelayed() throws QueueException;

    /**
     * Reclaim ACTIVE jobs whose lease expired.
     *
     * @return number of jobs reclaimed
     */
    long reapExpiredLeases() throws QueueException;

    /**
     * Reclaim every job leased by a worker regardless of lease expiry.
     *
     * @return number of jobs reclaimed
     */
    default long revokeLeases(String workerId) throws QueueException {
        return revokeLeases(workerId, Long.MAX_VALUE);
    }

    /**
     * Reclaim the jobs a worker leased before {@code grantedBefore}. Leases it took at or after that
     * time, for instance after registering again, are left alone.
     *
     * @return number of jobs reclaimed
     */
    long revokeLeases(String workerId, long grantedBefore) throws QueueException;

    /**
     * Restart recovery: reclaim jobs persisted as ACTIVE and rebuild the dispatch index.
     *
     * @return number of crash-recovered jobs
     */
    long recover() throws QueueException;

    /**
     * Submit a fresh copy of a FAILED job.
     *
     * @return id of the new job
     */
    String requeue(String failedJobId) throws QueueException;

    /**
     * Delete terminal jobs that finished before the cutoff. Execution records are kept.
     *
     * @return number of jobs deleted
     */
    long purgeTerminal(long finishedBefore) throws QueueException;

    Optional<Job<T>> getJob(String jobId) throws QueueException;

    /**
     * Get depth per state.
     */
    QueueMetrics getMetrics() throws QueueException;

    /**
     * Stop accepting new jobs. Claims and settlements keep working.
     */
    void drain();

    boolean isDraining();
}
