package com.umitunal.qdispatch.exception;

public class UnknownJobException extends QueueException {
    private final String jobId;

    public UnknownJobException(String jobId) {
        super("Job not found: " + jobId);
        this.jobId = jobId;
    }

    public String getJobId() { return jobId; }
}
