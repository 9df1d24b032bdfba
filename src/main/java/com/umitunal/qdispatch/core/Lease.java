package com.umitunal.qdispatch.core;

/**
 * Time-bounded exclusive claim of one worker on one job.
 *
 * @param jobId     leased job
 * @param workerId  lease holder
 * @param startedAt when the lease was granted, millis since epoch
 * @param expiresAt when the job becomes reclaimable, millis since epoch
 */
public record Lease(String jobId, String workerId, long startedAt, long expiresAt) {

    public boolean isExpired(long now) {
        return now > expiresAt;
    }

    public long remaining(long now) {
        return Math.max(0, expiresAt - now);
    }
}
