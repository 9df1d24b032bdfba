package com.umitunal.qdispatch.worker;

import com.umitunal.qdispatch.config.EngineConfig;
import com.umitunal.qdispatch.coordinator.WorkerCoordinator;
import com.umitunal.qdispatch.core.JobQueue;
import com.umitunal.qdispatch.exception.LeaseExpiredException;
import com.umitunal.qdispatch.exception.NotOwnerException;
import com.umitunal.qdispatch.exception.QueueException;
import com.umitunal.qdispatch.exception.UnknownWorkerException;
import com.umitunal.qdispatch.supervisor.ExecutionSupervisor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A fixed set of worker slots sharing one heartbeat timer.
 *
 * <p>Every tick heartbeats each slot and extends the lease of the job it is running, so a
 * long-running job keeps its lease for as long as its worker is alive.
 *
 * @param <T> the type of job payload
 */
public class WorkerPool<T> implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private final String name;
    private final JobQueue<T> queue;
    private final WorkerCoordinator<T> coordinator;
    private final long heartbeatInterval;
    private final List<QueueWorker<T>> workers;
    private final ScheduledExecutorService heartbeats;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public WorkerPool(String name, JobQueue<T> queue, WorkerCoordinator<T> coordinator,
                      ExecutionSupervisor<T> supervisor, EngineConfig config) {
        this.name = name;
        this.queue = queue;
        this.coordinator = coordinator;
        this.heartbeatInterval = config.getHeartbeatInterval();

        List<QueueWorker<T>> slots = new ArrayList<>();
        for (int i = 0; i < config.getWorkerCount(); i++) {
            slots.add(QueueWorker.builder(name + "-" + i, queue, coordinator, supervisor)
                    .withLeaseDuration(config.getLeaseDuration())
                    .withPollInterval(config.getPollInterval())
                    .build());
        }
        this.workers = Collections.unmodifiableList(slots);
        this.heartbeats = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "WorkerPool-" + name + "-heartbeat");
            thread.setDaemon(true);
            return thread;
        });
    }

    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        workers.forEach(QueueWorker::start);
        heartbeats.scheduleAtFixedRate(this::beat, heartbeatInterval, heartbeatInterval, TimeUnit.MILLISECONDS);
        log.info("Worker pool {} started with {} workers", name, workers.size());
    }

    /**
     * One heartbeat tick for every slot.
     */
    void beat() {
        for (QueueWorker<T> worker : workers) {
            if (!worker.isRunning()) {
                continue;
            }
            String workerId = worker.getWorkerId();
            try {
                coordinator.heartbeat(workerId);
                String jobId = worker.getCurrentJobId();
                if (jobId != null) {
                    queue.extendLease(jobId, workerId, worker.getLeaseDuration());
                }
            } catch (UnknownWorkerException e) {
                log.warn("Heartbeat rejected for {}, registering again", workerId);
                coordinator.register(workerId);
            } catch (LeaseExpiredException | NotOwnerException e) {
                // The job settled or was reclaimed between reading it and extending
                log.debug("Skipped lease extension for {}: {}", workerId, e.getMessage());
            } catch (QueueException e) {
                log.warn("Heartbeat for {} failed: {}", workerId, e.getMessage());
            } catch (RuntimeException e) {
                log.error("Heartbeat for {} failed unexpectedly", workerId, e);
            }
        }
    }

    /**
     * Stop claiming, let running jobs settle for up to {@code timeoutMillis} each, then deregister
     * every slot.
     */
    public void stop(long timeoutMillis) {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        workers.forEach(worker -> worker.stop(timeoutMillis));
        heartbeats.shutdownNow();
        for (QueueWorker<T> worker : workers) {
            try {
                coordinator.deregister(worker.getWorkerId());
            } catch (QueueException e) {
                log.warn("Failed to deregister {}: {}", worker.getWorkerId(), e.getMessage());
            }
        }
        log.info("Worker pool {} stopped", name);
    }

    public List<QueueWorker<T>> getWorkers() {
        return workers;
    }

    public long getProcessedCount() {
        return workers.stream().mapToLong(QueueWorker::getProcessedCount).sum();
    }

    public long getFailedCount() {
        return workers.stream().mapToLong(QueueWorker::getFailedCount).sum();
    }

    public boolean isRunning() {
        return running.get();
    }

    @Override
    public void close() {
        stop(heartbeatInterval * EngineConfig.LEASE_SAFETY_FACTOR);
    }
}
