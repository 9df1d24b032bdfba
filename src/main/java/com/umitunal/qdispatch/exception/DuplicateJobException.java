package com.umitunal.qdispatch.exception;

public class DuplicateJobException extends QueueException {
    private final String jobId;

    public DuplicateJobException(String jobId) {
        super("Job already exists: " + jobId);
        this.jobId = jobId;
    }

    public String getJobId() { return jobId; }
}
