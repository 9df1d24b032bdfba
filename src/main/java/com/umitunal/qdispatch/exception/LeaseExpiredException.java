package com.umitunal.qdispatch.exception;

/**
 * The caller's lease on a job expired or was revoked before it settled the job.
 */
public class LeaseExpiredException extends QueueException {
    private final String jobId;
    private final String workerId;

    public LeaseExpiredException(String jobId, String workerId) {
        super("Lease of worker '" + workerId + "' on job '" + jobId + "' is no longer valid");
        this.jobId = jobId;
        this.workerId = workerId;
    }

    public String getJobId() { return jobId; }
    public String getWorkerId() { return workerId; }
}
