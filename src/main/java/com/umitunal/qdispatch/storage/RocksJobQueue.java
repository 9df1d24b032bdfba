package com.umitunal.qdispatch.storage;

import com.umitunal.qdispatch.config.EngineConfig;
import com.umitunal.qdispatch.core.EnqueueOptions;
import com.umitunal.qdispatch.core.ExecutionRecord;
import com.umitunal.qdispatch.core.Job;
import com.umitunal.qdispatch.core.JobQueue;
import com.umitunal.qdispatch.core.JobState;
import com.umitunal.qdispatch.core.QueueMetrics;
import com.umitunal.qdispatch.core.RetryDecision;
import com.umitunal.qdispatch.exception.DuplicateJobException;
import com.umitunal.qdispatch.exception.LeaseExpiredException;
import com.umitunal.qdispatch.exception.NotOwnerException;
import com.umitunal.qdispatch.exception.QueueDrainingException;
import com.umitunal.qdispatch.exception.QueueException;
import com.umitunal.qdispatch.exception.TransientStoreException;
import com.umitunal.qdispatch.exception.UnknownJobException;
import com.umitunal.qdispatch.model.WorkUnit;
import com.umitunal.qdispatch.supervisor.RetryPolicy;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.rocksdb.Transaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;

/**
 * RocksDB-backed implementation of JobQueue.
 *
 * <p>Every state change runs in one optimistic transaction that reads the job with
 * {@code getForUpdate}, so two callers racing on the same job cannot both commit. Claims walk the
 * dispatch index in eligibility order and try each candidate in its own transaction; losing a race
 * just moves on to the next candidate.
 *
 * <p>Dispatch index entries are maintained inside the same transactions, but a stale entry (job
 * gone, no longer dispatchable, or re-indexed under another time) is tolerated and dropped the next
 * time a claim walks over it.
 *
 * @param <T> the type of job payload
 */
public class RocksJobQueue<T> implements JobQueue<T> {
    private static final Logger log = LoggerFactory.getLogger(RocksJobQueue.class);

    static final String LEASE_EXPIRED = "lease expired";
    static final String CRASH_RECOVERED = "crash recovered: lease held across restart";
    private static final int MAX_TXN_RETRIES = 8;

    private final RocksJobStore<T> store;
    private final RetryPolicy retryPolicy;
    private final Clock clock;
    private final int defaultMaxAttempts;
    private final AtomicBoolean draining = new AtomicBoolean(false);
    private final AtomicLong txnConflictCount = new AtomicLong(0);

    public RocksJobQueue(RocksJobStore<T> store, EngineConfig config) {
        this(store, config, RetryPolicy.from(config), Clock.systemUTC());
    }

    public RocksJobQueue(RocksJobStore<T> store, EngineConfig config, RetryPolicy retryPolicy, Clock clock) {
        this.store = store;
        this.retryPolicy = retryPolicy;
        this.clock = clock;
        this.defaultMaxAttempts = config.getDefaultMaxAttempts();
    }

    @Override
    public String enqueue(T payload, EnqueueOptions options) throws QueueException {
        String jobId = UUID.randomUUID().toString();
        enqueue(jobId, payload, options);
        return jobId;
    }

    @Override
    public void enqueue(String jobId, T payload, EnqueueOptions options) throws QueueException {
        if (jobId == null || jobId.isBlank()) {
            throw new IllegalArgumentException("jobId must not be blank");
        }
        if (draining.get()) {
            throw new QueueDrainingException();
        }
        long now = clock.millis();
        long eligibleAt;
        try {
            eligibleAt = Math.addExact(now, options.getDelayMillis());
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("delay of " + options.getDelayMillis() + " ms is out of range", e);
        }
        int maxAttempts = options.getMaxAttempts() > 0 ? options.getMaxAttempts() : defaultMaxAttempts;
        WorkUnit<T> unit = new WorkUnit<>(jobId, payload, maxAttempts, options.getTimeoutMillis(),
                now, eligibleAt);

        inTransaction("enqueue " + jobId, txn -> {
            if (store.readJob(txn, jobId) != null) {
                throw new DuplicateJobException(jobId);
            }
            store.writeJob(txn, unit);
            store.addToDispatch(txn, unit);
            return null;
        });
        log.debug("Enqueued job {} as {} (maxAttempts={}, eligibleAt={})",
                jobId, unit.getState(), maxAttempts, unit.getEligibleAt());
    }

    @Override
    public Job<T> claim(String workerId, long leaseDuration) throws QueueException {
        if (leaseDuration <= 0) {
            throw new IllegalArgumentException("leaseDuration must be positive");
        }
        long now = clock.millis();

        try (RocksIterator iter = store.newDispatchIterator()) {
            for (iter.seekToFirst(); iter.isValid(); iter.next()) {
                byte[] key = iter.key();

                // Index is ordered by eligibility time, nothing past this point is due
                if (StorageKeys.dispatchTime(key) > now) {
                    break;
                }

                WorkUnit<T> leased = tryAtomicClaim(key, workerId, leaseDuration, now);
                if (leased != null) {
                    log.debug("Worker {} claimed job {} (attempt {}/{})",
                            workerId, leased.getId(), leased.getCurrentAttempt(), leased.getMaxAttempts());
                    return leased;
                }
            }
            RocksJobStore.checkIterator(iter, "claim");
        }
        return null;
    }

    @Override
    public void ack(String jobId, String workerId, String result) throws QueueException {
        long now = clock.millis();
        int attempt = inTransaction("ack " + jobId, txn -> {
            WorkUnit<T> unit = requireLease(txn, jobId, workerId, now);
            long startedAt = unit.getLeaseStartedAt();
            int finished = unit.complete(now);
            store.writeJob(txn, unit);
            store.appendRecord(txn, new ExecutionRecord(jobId, finished, workerId, startedAt, now,
                    ExecutionRecord.Outcome.SUCCESS, result));
            return finished;
        });
        log.debug("Job {} completed by {} on attempt {}", jobId, workerId, attempt);
    }

    @Override
    public RetryDecision nack(String jobId, String workerId, String error, ExecutionRecord.Outcome outcome)
            throws QueueException {
        if (outcome == ExecutionRecord.Outcome.SUCCESS) {
            throw new IllegalArgumentException("nack requires a FAILURE or TIMEOUT outcome");
        }
        long now = clock.millis();
        RetryDecision decision = inTransaction("nack " + jobId, txn -> {
            WorkUnit<T> unit = requireLease(txn, jobId, workerId, now);
            long startedAt = unit.getLeaseStartedAt();
            int failed = unit.failAttempt(error, now);
            store.appendRecord(txn, new ExecutionRecord(jobId, failed, workerId, startedAt, now, outcome, error));

            RetryDecision result;
            if (unit.canRetry()) {
                long eligibleAt = now + retryPolicy.delay(unit.getAttempts());
                unit.scheduleRetry(eligibleAt, now);
                store.addToDispatch(txn, unit);
                result = RetryDecision.rescheduled(jobId, failed, eligibleAt);
            } else {
                unit.markFailed(now);
                result = RetryDecision.failed(jobId, failed);
            }
            store.writeJob(txn, unit);
            return result;
        });

        if (decision.isTerminal()) {
            log.warn("Job {} failed permanently after attempt {}: {}", jobId, decision.attempt(), error);
        } else {
            log.debug("Job {} attempt {} failed ({}), retry at {}",
                    jobId, decision.attempt(), outcome, decision.eligibleAt());
        }
        return decision;
    }

    @Override
    public void extendLease(String jobId, String workerId, long duration) throws QueueException {
        if (duration <= 0) {
            throw new IllegalArgumentException("duration must be positive");
        }
        long now = clock.millis();
        inTransaction("extend lease " + jobId, txn -> {
            WorkUnit<T> unit = requireLease(txn, jobId, workerId, now);
            unit.extendLease(duration, now);
            store.writeJob(txn, unit);
            return null;
        });
    }

    @Override
    public long promoteDelayed() throws QueueException {
        long now = clock.millis();
        long promoted = 0;

        try (RocksIterator iter = store.newDispatchIterator()) {
            for (iter.seekToFirst(); iter.isValid(); iter.next()) {
                byte[] key = iter.key();
                if (StorageKeys.dispatchTime(key) > now) {
                    break;
                }
                String jobId = StorageKeys.dispatchJobId(key);
                boolean changed = inTransaction("promote " + jobId, txn -> {
                    WorkUnit<T> unit = store.readJob(txn, jobId);
                    if (unit == null || unit.getState() != JobState.DELAYED || unit.getEligibleAt() > now) {
                        return false;
                    }
                    unit.promote(now);
                    store.writeJob(txn, unit);
                    return true;
                });
                if (changed) {
                    promoted++;
                }
            }
            RocksJobStore.checkIterator(iter, "promote delayed");
        }

        if (promoted > 0) {
            log.debug("Promoted {} delayed jobs to WAITING", promoted);
        }
        return promoted;
    }

    @Override
    public long reapExpiredLeases() throws QueueException {
        long now = clock.millis();
        long reclaimed = reclaimWhere(unit -> unit.isLeaseExpired(now), LEASE_EXPIRED, now);
        if (reclaimed > 0) {
            log.warn("Reaper reclaimed {} jobs with expired leases", reclaimed);
        }
        return reclaimed;
    }

    @Override
    public long revokeLeases(String workerId, long grantedBefore) throws QueueException {
        long now = clock.millis();
        long revoked = reclaimWhere(unit -> unit.isHeldBy(workerId) && unit.getLeaseStartedAt() < grantedBefore,
                "lease revoked: worker " + workerId + " is dead", now);
        if (revoked > 0) {
            log.warn("Revoked {} leases held by worker {}", revoked, workerId);
        }
        return revoked;
    }

    @Override
    public long recover() throws QueueException {
        long now = clock.millis();
        long recovered = reclaimWhere(unit -> unit.getState() == JobState.ACTIVE, CRASH_RECOVERED, now);

        long reindexed = 0;
        for (String jobId : jobIdsWhere(unit -> unit.getState().isDispatchable())) {
            inTransaction("reindex " + jobId, txn -> {
                WorkUnit<T> unit = store.readJob(txn, jobId);
                if (unit != null && unit.getState().isDispatchable()) {
                    store.addToDispatch(txn, unit);
                }
                return null;
            });
            reindexed++;
        }

        log.info("Recovery finished: {} jobs crash-recovered, {} dispatchable jobs indexed", recovered, reindexed);
        return recovered;
    }

    @Override
    public String requeue(String failedJobId) throws QueueException {
        WorkUnit<T> failed = store.loadJob(failedJobId).orElseThrow(() -> new UnknownJobException(failedJobId));
        if (failed.getState() != JobState.FAILED) {
            throw new IllegalStateException(
                    "Only FAILED jobs can be requeued, job " + failedJobId + " is " + failed.getState());
        }
        String newId = enqueue(failed.getPayload(), EnqueueOptions.newBuilder()
                .withMaxAttempts(failed.getMaxAttempts())
                .withTimeout(failed.getTimeoutMillis())
                .build());
        log.info("Requeued failed job {} as {}", failedJobId, newId);
        return newId;
    }

    @Override
    public long purgeTerminal(long finishedBefore) throws QueueException {
        long purged = 0;
        for (String jobId : jobIdsWhere(unit -> unit.getState().isTerminal() && unit.getFinishedAt() < finishedBefore)) {
            boolean deleted = inTransaction("purge " + jobId, txn -> {
                WorkUnit<T> unit = store.readJob(txn, jobId);
                if (unit == null || !unit.getState().isTerminal()) {
                    return false;
                }
                store.removeJob(txn, jobId);
                return true;
            });
            if (deleted) {
                purged++;
            }
        }
        if (purged > 0) {
            log.info("Purged {} terminal jobs finished before {}", purged, finishedBefore);
        }
        return purged;
    }

    @Override
    public Optional<Job<T>> getJob(String jobId) throws QueueException {
        return store.loadJob(jobId).map(unit -> unit);
    }

    @Override
    public QueueMetrics getMetrics() throws QueueException {
        long waiting = 0;
        long active = 0;
        long delayed = 0;
        long completed = 0;
        long failed = 0;

        try (RocksIterator iter = store.newJobIterator()) {
            for (iter.seekToFirst(); iter.isValid(); iter.next()) {
                WorkUnit<T> unit = WorkUnit.deserialize(iter.value(), store.getCodec());
                switch (unit.getState()) {
                    case WAITING -> waiting++;
                    case ACTIVE -> active++;
                    case DELAYED -> delayed++;
                    case COMPLETED -> completed++;
                    case FAILED -> failed++;
                }
            }
            RocksJobStore.checkIterator(iter, "metrics");
        }

        return new QueueMetrics(waiting, active, delayed, completed, failed);
    }

    @Override
    public void drain() {
        if (draining.compareAndSet(false, true)) {
            log.info("Queue draining: new jobs are rejected");
        }
    }

    @Override
    public boolean isDraining() {
        return draining.get();
    }

    /**
     * Commits retried because another claimer or settler touched the same job first.
     */
    public long getTransactionConflictCount() {
        return txnConflictCount.get();
    }

    /**
     * Claim one dispatch candidate in its own transaction.
     *
     * @return the leased job, or null if the candidate was stale or another claimer won
     */
    private WorkUnit<T> tryAtomicClaim(byte[] dispatchKey, String workerId, long leaseDuration, long now)
            throws TransientStoreException {
        String jobId = StorageKeys.dispatchJobId(dispatchKey);
        long indexedAt = StorageKeys.dispatchTime(dispatchKey);

        try (Transaction txn = store.beginTransaction()) {
            WorkUnit<T> current = store.readJob(txn, jobId);

            if (current == null
                    || !current.getState().isDispatchable()
                    || current.getEligibleAt() != indexedAt) {
                store.removeFromDispatch(txn, dispatchKey);
                txn.commit();
                return null;
            }

            if (!current.isClaimable(now)) {
                return null;
            }

            current.lease(workerId, leaseDuration, now);
            store.removeFromDispatch(txn, dispatchKey);
            store.writeJob(txn, current);
            txn.commit();
            return current;

        } catch (RocksDBException e) {
            if (RocksJobStore.isConflict(e)) {
                // Another worker got it first
                txnConflictCount.incrementAndGet();
                return null;
            }
            throw new TransientStoreException("Failed to claim job " + jobId, e);
        }
    }

    /**
     * Validate that {@code workerId} holds a live lease on the job.
     */
    private WorkUnit<T> requireLease(Transaction txn, String jobId, String workerId, long now)
            throws RocksDBException, QueueException {
        WorkUnit<T> unit = store.readJob(txn, jobId);
        if (unit == null) {
            throw new UnknownJobException(jobId);
        }
        if (unit.getState() != JobState.ACTIVE) {
            throw new LeaseExpiredException(jobId, workerId);
        }
        if (!workerId.equals(unit.getLeaseOwner())) {
            throw new NotOwnerException(jobId, workerId, unit.getLeaseOwner());
        }
        if (unit.isLeaseExpired(now)) {
            throw new LeaseExpiredException(jobId, workerId);
        }
        return unit;
    }

    /**
     * Reclaim every ACTIVE job matching the predicate, re-checked inside each job's transaction.
     * A reclaim consumes an attempt; the job returns to WAITING or fails once attempts run out.
     */
    private long reclaimWhere(Predicate<WorkUnit<T>> predicate, String reason, long now) throws QueueException {
        long reclaimed = 0;
        for (String jobId : jobIdsWhere(unit -> unit.getState() == JobState.ACTIVE && predicate.test(unit))) {
            boolean changed = inTransaction("reclaim " + jobId, txn -> {
                WorkUnit<T> unit = store.readJob(txn, jobId);
                if (unit == null || unit.getState() != JobState.ACTIVE || !predicate.test(unit)) {
                    return false;
                }
                String owner = unit.getLeaseOwner();
                long startedAt = unit.getLeaseStartedAt();
                int attempt = unit.reclaim(reason, now);
                store.appendRecord(txn, new ExecutionRecord(jobId, attempt, owner, startedAt, now,
                        ExecutionRecord.Outcome.TIMEOUT, reason));
                if (unit.canRetry()) {
                    unit.markWaiting(now);
                    store.addToDispatch(txn, unit);
                    log.warn("Reclaimed job {} from worker {} ({}), attempt {}/{}",
                            jobId, owner, reason, attempt, unit.getMaxAttempts());
                } else {
                    unit.markFailed(now);
                    log.warn("Job {} failed permanently: {} on final attempt {}", jobId, reason, attempt);
                }
                store.writeJob(txn, unit);
                return true;
            });
            if (changed) {
                reclaimed++;
            }
        }
        return reclaimed;
    }

    private List<String> jobIdsWhere(Predicate<WorkUnit<T>> predicate) throws TransientStoreException {
        List<String> ids = new ArrayList<>();
        try (RocksIterator iter = store.newJobIterator()) {
            for (iter.seekToFirst(); iter.isValid(); iter.next()) {
                WorkUnit<T> unit = WorkUnit.deserialize(iter.value(), store.getCodec());
                if (predicate.test(unit)) {
                    ids.add(unit.getId());
                }
            }
            RocksJobStore.checkIterator(iter, "scan jobs");
        }
        return ids;
    }

    /**
     * Run a read-modify-write against one job, retrying when another transaction commits first.
     */
    private <R> R inTransaction(String operation, TxnWork<R> work) throws QueueException {
        for (int attempt = 1; ; attempt++) {
            try (Transaction txn = store.beginTransaction()) {
                R result = work.apply(txn);
                txn.commit();
                return result;
            } catch (RocksDBException e) {
                if (!RocksJobStore.isConflict(e)) {
                    throw new TransientStoreException("Failed to " + operation, e);
                }
                txnConflictCount.incrementAndGet();
                if (attempt >= MAX_TXN_RETRIES) {
                    throw new TransientStoreException(
                            "Gave up on " + operation + " after " + attempt + " conflicting commits", e);
                }
                log.debug("Commit conflict on {}, retrying ({}/{})", operation, attempt, MAX_TXN_RETRIES);
            }
        }
    }

    @FunctionalInterface
    private interface TxnWork<R> {
        R apply(Transaction txn) throws RocksDBException, QueueException;
    }
}
