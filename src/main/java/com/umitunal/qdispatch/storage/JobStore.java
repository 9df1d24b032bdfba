package com.umitunal.qdispatch.storage;

import com.umitunal.qdispatch.core.ExecutionRecord;
import com.umitunal.qdispatch.exception.TransientStoreException;
import com.umitunal.qdispatch.model.WorkUnit;

import java.util.List;
import java.util.Optional;

/**
 * Durable record of jobs and their execution history. The source of truth after a restart:
 * the latest persisted job record always carries the job's current state.
 *
 * @param <T> the type of job payload
 */
public interface JobStore<T> extends AutoCloseable {

    /**
     * Write the current state of a job, replacing any earlier record.
     */
    void persist(WorkUnit<T> unit) throws TransientStoreException;

    /**
     * Append an execution record.
     *
     * @throws IllegalStateException if a record for the same job and attempt exists
     */
    void persist(ExecutionRecord record) throws TransientStoreException;

    Optional<WorkUnit<T>> loadJob(String jobId) throws TransientStoreException;

    List<WorkUnit<T>> listJobs(JobFilter filter) throws TransientStoreException;

    /**
     * Records of one job in attempt order.
     */
    List<ExecutionRecord> listRecords(String jobId) throws TransientStoreException;

    /**
     * Records finished in {@code [fromMs, toMs)}, oldest first.
     */
    List<ExecutionRecord> listRecords(long fromMs, long toMs, int limit) throws TransientStoreException;

    /**
     * The most recently finished records, newest first.
     */
    List<ExecutionRecord> listRecentRecords(int limit) throws TransientStoreException;

    /**
     * Delete a job record. Its execution records are kept.
     *
     * @return true if the job existed
     */
    boolean deleteJob(String jobId) throws TransientStoreException;

    /**
     * Cheap read against the backend, for liveness probes.
     */
    boolean isReachable();

    @Override
    void close();
}
