package com.umitunal.qdispatch.model;

import com.umitunal.qdispatch.core.Job;
import com.umitunal.qdispatch.core.JobState;
import com.umitunal.qdispatch.core.Lease;
import com.umitunal.qdispatch.serialization.PayloadCodec;

/**
 * Concrete implementation of a Job with full state management.
 * Every state change bumps {@link #getVersion()}.
 *
 * @param <T> the type of the job payload
 */
public class WorkUnit<T> implements Job<T> {
    private final String id;
    private final T payload;
    private final int maxAttempts;
    private final long timeoutMillis;
    private final long enqueuedAt;

    private JobState state;
    private int attempts;
    private int reclaimCount;
    private long eligibleAt;
    private String leaseOwner;
    private long leaseStartedAt;
    private long leaseExpiresAt;
    private String lastError;
    private long finishedAt;
    private long lastModified;
    private long version;

    public WorkUnit(String id, T payload, int maxAttempts, long timeoutMillis, long enqueuedAt, long eligibleAt) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1: " + maxAttempts);
        }
        this.id = id;
        this.payload = payload;
        this.maxAttempts = maxAttempts;
        this.timeoutMillis = timeoutMillis;
        this.enqueuedAt = enqueuedAt;
        this.eligibleAt = eligibleAt;
        this.state = eligibleAt > enqueuedAt ? JobState.DELAYED : JobState.WAITING;
        this.lastModified = enqueuedAt;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public T getPayload() {
        return payload;
    }

    @Override
    public JobState getState() {
        return state;
    }

    @Override
    public int getAttempts() {
        return attempts;
    }

    @Override
    public int getMaxAttempts() {
        return maxAttempts;
    }

    @Override
    public long getEnqueuedAt() {
        return enqueuedAt;
    }

    @Override
    public long getEligibleAt() {
        return eligibleAt;
    }

    @Override
    public long getTimeoutMillis() {
        return timeoutMillis;
    }

    @Override
    public String getLastError() {
        return lastError;
    }

    @Override
    public Lease getLease() {
        if (state != JobState.ACTIVE) {
            return null;
        }
        return new Lease(id, leaseOwner, leaseStartedAt, leaseExpiresAt);
    }

    public int getReclaimCount() {
        return reclaimCount;
    }

    public String getLeaseOwner() {
        return leaseOwner;
    }

    public long getLeaseStartedAt() {
        return leaseStartedAt;
    }

    public long getLeaseExpiresAt() {
        return leaseExpiresAt;
    }

    public long getFinishedAt() {
        return finishedAt;
    }

    public long getLastModified() {
        return lastModified;
    }

    public long getVersion() {
        return version;
    }

    // Package-private setters for deserialization
    void setState(JobState state) {
        this.state = state;
    }

    void setAttempts(int attempts) {
        this.attempts = attempts;
    }

    void setReclaimCount(int reclaimCount) {
        this.reclaimCount = reclaimCount;
    }

    void setEligibleAt(long eligibleAt) {
        this.eligibleAt = eligibleAt;
    }

    void setLeaseOwner(String leaseOwner) {
        this.leaseOwner = leaseOwner;
    }

    void setLeaseStartedAt(long leaseStartedAt) {
        this.leaseStartedAt = leaseStartedAt;
    }

    void setLeaseExpiresAt(long leaseExpiresAt) {
        this.leaseExpiresAt = leaseExpiresAt;
    }

    void setLastError(String lastError) {
        this.lastError = lastError;
    }

    void setFinishedAt(long finishedAt) {
        this.finishedAt = finishedAt;
    }

    void setLastModified(long lastModified) {
        this.lastModified = lastModified;
    }

    void setVersion(long version) {
        this.version = version;
    }

    /**
     * WAITING, or DELAYED with its time already come.
     */
    public boolean isClaimable(long now) {
        return state == JobState.WAITING || (state == JobState.DELAYED && eligibleAt <= now);
    }

    public boolean isLeaseExpired(long now) {
        return state == JobState.ACTIVE && now > leaseExpiresAt;
    }

    public boolean isHeldBy(String workerId) {
        return state == JobState.ACTIVE && workerId.equals(leaseOwner);
    }

    public void lease(String workerId, long durationMs, long now) {
        if (!isClaimable(now)) {
            throw new IllegalStateException("Job " + id + " is not claimable in state " + state);
        }
        if (!canRetry()) {
            throw new IllegalStateException("Job " + id + " has no attempts left");
        }
        this.leaseOwner = workerId;
        this.leaseStartedAt = now;
        this.leaseExpiresAt = now + durationMs;
        this.state = JobState.ACTIVE;
        touch(now);
    }

    public void extendLease(long durationMs, long now) {
        this.leaseExpiresAt = now + durationMs;
        touch(now);
    }

    /**
     * Settle the running attempt as successful.
     *
     * @return the attempt number that completed
     */
    public int complete(long now) {
        int attempt = finishAttempt();
        this.state = JobState.COMPLETED;
        this.lastError = null;
        this.finishedAt = now;
        clearLease();
        touch(now);
        return attempt;
    }

    /**
     * Count the running attempt as failed. The caller then reschedules or fails the job.
     *
     * @return the attempt number that failed
     */
    public int failAttempt(String error, long now) {
        int attempt = finishAttempt();
        this.lastError = error;
        clearLease();
        touch(now);
        return attempt;
    }

    /**
     * Count the running attempt as lost to lease expiry or revocation.
     *
     * @return the attempt number that was reclaimed
     */
    public int reclaim(String reason, long now) {
        this.reclaimCount++;
        return failAttempt(reason, now);
    }

    public void scheduleRetry(long eligibleAt, long now) {
        this.state = JobState.DELAYED;
        this.eligibleAt = eligibleAt;
        touch(now);
    }

    public void markWaiting(long now) {
        this.state = JobState.WAITING;
        this.eligibleAt = now;
        touch(now);
    }

    public void promote(long now) {
        if (state != JobState.DELAYED) {
            throw new IllegalStateException("Only DELAYED jobs can be promoted, job " + id + " is " + state);
        }
        this.state = JobState.WAITING;
        touch(now);
    }

    public void markFailed(long now) {
        this.state = JobState.FAILED;
        this.finishedAt = now;
        clearLease();
        touch(now);
    }

    private int finishAttempt() {
        if (state != JobState.ACTIVE) {
            throw new IllegalStateException("Job " + id + " has no running attempt in state " + state);
        }
        this.attempts++;
        return attempts;
    }

    private void clearLease() {
        this.leaseOwner = null;
        this.leaseStartedAt = 0;
        this.leaseExpiresAt = 0;
    }

    private void touch(long now) {
        this.lastModified = now;
        this.version++;
    }

    @Override
    public String toString() {
        return String.format("WorkUnit{id='%s', state=%s, attempts=%d/%d, eligibleAt=%d, worker='%s'}",
                id, state, attempts, maxAttempts, eligibleAt, leaseOwner);
    }

    /**
     * Serialize to bytes for storage.
     * Delegates to WorkUnitSerializer for actual serialization logic.
     */
    public byte[] serialize(PayloadCodec<T> codec) {
        return new WorkUnitSerializer<>(codec).serialize(this);
    }

    /**
     * Deserialize from bytes.
     * Delegates to WorkUnitSerializer for actual deserialization logic.
     */
    public static <T> WorkUnit<T> deserialize(byte[] bytes, PayloadCodec<T> codec) {
        return new WorkUnitSerializer<>(codec).deserialize(bytes);
    }
}
