package com.umitunal.qdispatch.worker;

import com.umitunal.qdispatch.coordinator.WorkerCoordinator;
import com.umitunal.qdispatch.core.ExecutionRecord;
import com.umitunal.qdispatch.core.Job;
import com.umitunal.qdispatch.core.JobQueue;
import com.umitunal.qdispatch.core.RetryDecision;
import com.umitunal.qdispatch.exception.LeaseExpiredException;
import com.umitunal.qdispatch.exception.NotOwnerException;
import com.umitunal.qdispatch.exception.QueueException;
import com.umitunal.qdispatch.exception.TransientStoreException;
import com.umitunal.qdispatch.exception.UnknownWorkerException;
import com.umitunal.qdispatch.supervisor.ExecutionSupervisor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One worker slot: claims a job through the coordinator, runs it under the supervisor and settles it.
 *
 * @param <T> the type of job payload
 */
public class QueueWorker<T> implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(QueueWorker.class);

    private final String workerId;
    private final JobQueue<T> queue;
    private final WorkerCoordinator<T> coordinator;
    private final ExecutionSupervisor<T> supervisor;
    private final long leaseDuration;
    private final long pollInterval;
    private final AtomicBoolean running;
    private final AtomicLong processedCount;
    private final AtomicLong failedCount;
    private final AtomicReference<String> currentJobId;

    private Thread workerThread;

    private QueueWorker(Builder<T> builder) {
        this.workerId = builder.workerId;
        this.queue = builder.queue;
        this.coordinator = builder.coordinator;
        this.supervisor = builder.supervisor;
        this.leaseDuration = builder.leaseDuration;
        this.pollInterval = builder.pollInterval;
        this.running = new AtomicBoolean(false);
        this.processedCount = new AtomicLong(0);
        this.failedCount = new AtomicLong(0);
        this.currentJobId = new AtomicReference<>();
    }

    /**
     * Register with the coordinator and start polling in the background.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            coordinator.register(workerId);
            workerThread = new Thread(this::run, "QueueWorker-" + workerId);
            workerThread.setDaemon(false);
            workerThread.start();
        }
    }

    /**
     * Stop polling and wait for the job in hand to settle, up to {@code timeoutMillis}.
     */
    public void stop(long timeoutMillis) {
        running.set(false);
        if (workerThread != null) {
            try {
                workerThread.join(timeoutMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Claim and process a single job synchronously.
     *
     * @return true if a job was claimed
     */
    public boolean processOne() throws QueueException {
        Job<T> job = coordinator.claim(workerId, leaseDuration);
        if (job == null) {
            return false;
        }

        currentJobId.set(job.getId());
        try {
            ExecutionRecord record = supervisor.run(job, workerId);
            settle(job, record);
        } catch (LeaseExpiredException | NotOwnerException e) {
            // Someone reclaimed the job while we ran it; its result no longer counts
            log.warn("Worker {} lost the lease on job {}: {}", workerId, job.getId(), e.getMessage());
            failedCount.incrementAndGet();
        } finally {
            currentJobId.set(null);
            coordinator.release(workerId);
        }
        return true;
    }

    private void settle(Job<T> job, ExecutionRecord record) throws QueueException {
        if (record.outcome() == ExecutionRecord.Outcome.SUCCESS) {
            queue.ack(job.getId(), workerId, record.resultOrError());
            processedCount.incrementAndGet();
            return;
        }
        RetryDecision decision = queue.nack(job.getId(), workerId, record.resultOrError(), record.outcome());
        failedCount.incrementAndGet();
        log.debug("Worker {} settled job {} attempt {} as {}: {}",
                workerId, job.getId(), decision.attempt(), record.outcome(), decision.action());
    }

    private void run() {
        while (running.get()) {
            try {
                boolean processed = processOne();

                if (!processed) {
                    // No jobs available, wait before polling again
                    Thread.sleep(pollInterval);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (UnknownWorkerException e) {
                log.warn("Worker {} is no longer known to the coordinator, registering again", workerId);
                coordinator.register(workerId);
            } catch (TransientStoreException e) {
                log.warn("Worker {} hit a store error, polling again: {}", workerId, e.getMessage());
                pause();
            } catch (Exception e) {
                log.error("Worker {} failed unexpectedly", workerId, e);
                pause();
            }
        }
    }

    private void pause() {
        try {
            Thread.sleep(pollInterval);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running.set(false);
        }
    }

    public String getWorkerId() { return workerId; }
    public long getProcessedCount() { return processedCount.get(); }
    public long getFailedCount() { return failedCount.get(); }
    public boolean isRunning() { return running.get(); }

    /**
     * @return id of the job this slot is running, or null when idle
     */
    public String getCurrentJobId() { return currentJobId.get(); }

    public long getLeaseDuration() { return leaseDuration; }

    @Override
    public void close() {
        stop(leaseDuration);
    }

    public static <T> Builder<T> builder(String workerId, JobQueue<T> queue,
                                         WorkerCoordinator<T> coordinator, ExecutionSupervisor<T> supervisor) {
        return new Builder<>(workerId, queue, coordinator, supervisor);
    }

    public static class Builder<T> {
        private final String workerId;
        private final JobQueue<T> queue;
        private final WorkerCoordinator<T> coordinator;
        private final ExecutionSupervisor<T> supervisor;
        private long leaseDuration = 30000; // 30 seconds
        private long pollInterval = 1000;   // 1 second

        private Builder(String workerId, JobQueue<T> queue,
                        WorkerCoordinator<T> coordinator, ExecutionSupervisor<T> supervisor) {
            this.workerId = workerId;
            this.queue = queue;
            this.coordinator = coordinator;
            this.supervisor = supervisor;
        }

        public Builder<T> withLeaseDuration(long millis) {
            this.leaseDuration = millis;
            return this;
        }

        public Builder<T> withPollInterval(long millis) {
            this.pollInterval = millis;
            return this;
        }

        public QueueWorker<T> build() {
            return new QueueWorker<>(this);
        }
    }
}
