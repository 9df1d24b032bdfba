package com.umitunal.qdispatch.coordinator;

import com.umitunal.qdispatch.core.Job;
import com.umitunal.qdispatch.core.JobQueue;
import com.umitunal.qdispatch.exception.QueueException;
import com.umitunal.qdispatch.exception.UnknownWorkerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks live workers and hands out work to them.
 *
 * <p>Each worker is a small heartbeat-driven state machine: IDLE and BUSY while it keeps
 * heartbeating, DEAD once it has been silent for longer than the liveness window. Declaring a worker
 * dead revokes its leases right away instead of waiting for them to expire.
 *
 * @param <T> the type of job payload
 */
public class WorkerCoordinator<T> {
    private static final Logger log = LoggerFactory.getLogger(WorkerCoordinator.class);

    private final JobQueue<T> queue;
    private final Clock clock;
    private final long livenessWindow;
    private final Map<String, WorkerRecord> workers = new ConcurrentHashMap<>();

    public WorkerCoordinator(JobQueue<T> queue, long livenessWindow, Clock clock) {
        if (livenessWindow <= 0) {
            throw new IllegalArgumentException("livenessWindow must be positive");
        }
        this.queue = queue;
        this.livenessWindow = livenessWindow;
        this.clock = clock;
    }

    /**
     * Register a worker, or revive one that was declared dead. Registering a live worker
     * refreshes its heartbeat.
     */
    public void register(String workerId) {
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("workerId must not be blank");
        }
        long now = clock.millis();
        WorkerRecord previous = workers.put(workerId, WorkerRecord.registered(workerId, now));
        if (previous == null) {
            log.info("Worker {} registered", workerId);
        } else if (!previous.isLive()) {
            log.info("Worker {} re-registered after being declared dead", workerId);
        }
    }

    /**
     * @throws UnknownWorkerException if the worker is not registered or was declared dead
     */
    public void heartbeat(String workerId) throws UnknownWorkerException {
        long now = clock.millis();
        WorkerRecord updated = workers.computeIfPresent(workerId,
                (id, worker) -> worker.isLive() ? worker.withHeartbeat(now) : worker);
        requireLive(workerId, updated);
    }

    public Set<String> listLiveWorkers() {
        Set<String> live = new TreeSet<>();
        for (WorkerRecord worker : workers.values()) {
            if (worker.isLive()) {
                live.add(worker.workerId());
            }
        }
        return Collections.unmodifiableSet(live);
    }

    public List<WorkerRecord> listWorkers() {
        List<WorkerRecord> all = new ArrayList<>(workers.values());
        all.sort((a, b) -> a.workerId().compareTo(b.workerId()));
        return all;
    }

    public Optional<WorkerRecord> getWorker(String workerId) {
        return Optional.ofNullable(workers.get(workerId));
    }

    /**
     * Claim the next job on behalf of a live worker and mark it BUSY when one is returned.
     *
     * @return the leased job, or null if none is eligible
     */
    public Job<T> claim(String workerId, long leaseDuration) throws QueueException {
        requireLive(workerId, workers.get(workerId));
        Job<T> job = queue.claim(workerId, leaseDuration);
        if (job != null) {
            workers.computeIfPresent(workerId,
                    (id, worker) -> worker.isLive() ? worker.withStatus(WorkerStatus.BUSY) : worker);
        }
        return job;
    }

    /**
     * Mark a worker IDLE after it settled (or gave up on) its job.
     */
    public void release(String workerId) {
        workers.computeIfPresent(workerId,
                (id, worker) -> worker.status() == WorkerStatus.BUSY ? worker.withStatus(WorkerStatus.IDLE) : worker);
    }

    /**
     * Remove a worker that is shutting down. Any lease it still holds is revoked.
     */
    public void deregister(String workerId) throws QueueException {
        WorkerRecord removed = workers.remove(workerId);
        if (removed == null) {
            return;
        }
        long revoked = queue.revokeLeases(workerId);
        log.info("Worker {} deregistered ({} leases revoked)", workerId, revoked);
    }

    /**
     * Declare every worker silent for longer than the liveness window dead and revoke its leases.
     *
     * @return ids of workers declared dead by this call
     */
    public List<String> detectDeadWorkers() throws QueueException {
        long now = clock.millis();
        List<String> declared = new ArrayList<>();

        for (String workerId : workers.keySet()) {
            boolean[] transitioned = new boolean[1];
            // Decide inside compute so a heartbeat that raced in wins
            WorkerRecord after = workers.computeIfPresent(workerId, (id, worker) -> {
                if (worker.isLive() && worker.isStale(now, livenessWindow)) {
                    transitioned[0] = true;
                    return worker.withStatus(WorkerStatus.DEAD);
                }
                return worker;
            });
            if (transitioned[0]) {
                log.warn("Worker {} declared dead: no heartbeat for {} ms",
                        workerId, now - after.lastHeartbeatAt());
                declared.add(workerId);
            }
        }

        // Leases taken after the declaration belong to a re-registered worker
        for (String workerId : declared) {
            queue.revokeLeases(workerId, now);
        }
        return declared;
    }

    public long getLivenessWindow() {
        return livenessWindow;
    }

    private static void requireLive(String workerId, WorkerRecord worker) throws UnknownWorkerException {
        if (worker == null) {
            throw new UnknownWorkerException(workerId, "is not registered");
        }
        if (!worker.isLive()) {
            throw new UnknownWorkerException(workerId, "was declared dead and must register again");
        }
    }
}
