package com.umitunal.qdispatch.core;

/**
 * Lifecycle states of a job. A job is in exactly one of these at a time.
 */
public enum JobState {
    WAITING,     // Eligible for dispatch
    ACTIVE,      // Leased by a worker
    COMPLETED,   // Acknowledged by its worker
    FAILED,      // Attempts exhausted
    DELAYED;     // Not eligible until its eligibleAt time

    /**
     * Terminal jobs are never leased again.
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Whether a job in this state belongs in the dispatch index.
     */
    public boolean isDispatchable() {
        return this == WAITING || this == DELAYED;
    }
}
