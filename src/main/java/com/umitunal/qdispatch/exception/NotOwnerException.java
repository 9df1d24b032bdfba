package com.umitunal.qdispatch.exception;

/**
 * A worker tried to settle or extend a job that another worker holds.
 */
public class NotOwnerException extends QueueException {
    private final String jobId;
    private final String workerId;
    private final String owner;

    public NotOwnerException(String jobId, String workerId, String owner) {
        super("Worker '" + workerId + "' does not own job '" + jobId + "' (held by '" + owner + "')");
        this.jobId = jobId;
        this.workerId = workerId;
        this.owner = owner;
    }

    public String getJobId() { return jobId; }
    public String getWorkerId() { return workerId; }
    public String getOwner() { return owner; }
}
