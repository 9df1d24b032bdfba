package com.umitunal.qdispatch.exception;

/**
 * The worker never registered, deregistered, or was declared dead and must register again.
 */
public class UnknownWorkerException extends QueueException {
    private final String workerId;

    public UnknownWorkerException(String workerId, String reason) {
        super("Worker '" + workerId + "' " + reason);
        this.workerId = workerId;
    }

    public String getWorkerId() { return workerId; }
}
