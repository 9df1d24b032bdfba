package com.umitunal.qdispatch.engine;

import com.umitunal.qdispatch.config.EngineConfig;
import com.umitunal.qdispatch.coordinator.WorkerCoordinator;
import com.umitunal.qdispatch.core.JobQueue;
import com.umitunal.qdispatch.exception.QueueException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodic housekeeping: promote due DELAYED jobs, reap expired leases and detect dead workers.
 *
 * <p>A failing tick is logged and the next one runs as scheduled.
 */
public class MaintenanceScheduler implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(MaintenanceScheduler.class);

    private final JobQueue<?> queue;
    private final WorkerCoordinator<?> coordinator;
    private final long sweepInterval;
    private final long reaperInterval;
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public MaintenanceScheduler(JobQueue<?> queue, WorkerCoordinator<?> coordinator, EngineConfig config) {
        this.queue = queue;
        this.coordinator = coordinator;
        this.sweepInterval = config.getDelayedSweepInterval();
        this.reaperInterval = config.getReaperInterval();
        this.scheduler = Executors.newScheduledThreadPool(2, r -> {
            Thread thread = new Thread(r, "qdispatch-maintenance");
            thread.setDaemon(true);
            return thread;
        });
    }

    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        scheduler.scheduleWithFixedDelay(this::sweepDelayed, sweepInterval, sweepInterval, TimeUnit.MILLISECONDS);
        scheduler.scheduleWithFixedDelay(this::reap, reaperInterval, reaperInterval, TimeUnit.MILLISECONDS);
        log.info("Maintenance started (sweep every {} ms, reaper every {} ms)", sweepInterval, reaperInterval);
    }

    /**
     * Move due DELAYED jobs to WAITING.
     */
    long sweepDelayed() {
        try {
            return queue.promoteDelayed();
        } catch (QueueException | RuntimeException e) {
            log.error("Delayed sweep failed", e);
            return 0;
        }
    }

    /**
     * Declare silent workers dead (revoking their leases), then reclaim whatever leases expired.
     */
    long reap() {
        long reclaimed = 0;
        try {
            List<String> dead = coordinator.detectDeadWorkers();
            if (!dead.isEmpty()) {
                log.info("Declared {} workers dead: {}", dead.size(), dead);
            }
        } catch (QueueException | RuntimeException e) {
            log.error("Dead worker detection failed", e);
        }
        try {
            reclaimed = queue.reapExpiredLeases();
        } catch (QueueException | RuntimeException e) {
            log.error("Lease reaper failed", e);
        }
        return reclaimed;
    }

    public boolean isRunning() {
        return running.get() && !scheduler.isShutdown();
    }

    @Override
    public void close() {
        if (!running.compareAndSet(true, false)) {
            scheduler.shutdownNow();
            return;
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(reaperInterval, TimeUnit.MILLISECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            scheduler.shutdownNow();
        }
        log.info("Maintenance stopped");
    }
}
