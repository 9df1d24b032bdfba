package com.umitunal.qdispatch.monitor;

import com.umitunal.qdispatch.coordinator.WorkerCoordinator;
import com.umitunal.qdispatch.coordinator.WorkerRecord;
import com.umitunal.qdispatch.core.ExecutionRecord;
import com.umitunal.qdispatch.core.JobQueue;
import com.umitunal.qdispatch.core.QueueMetrics;
import com.umitunal.qdispatch.exception.QueueException;
import com.umitunal.qdispatch.exception.TransientStoreException;
import com.umitunal.qdispatch.storage.JobStore;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.BooleanSupplier;

/**
 * Read-only view over the queue, the store and the coordinator.
 */
public class QueueMonitor {
    private final JobQueue<?> queue;
    private final JobStore<?> store;
    private final WorkerCoordinator<?> coordinator;
    private final BooleanSupplier coordinatorRunning;
    private final Clock clock;

    /**
     * @param coordinatorRunning reports whether heartbeat and dead worker detection are active
     */
    public QueueMonitor(JobQueue<?> queue, JobStore<?> store, WorkerCoordinator<?> coordinator,
                        BooleanSupplier coordinatorRunning, Clock clock) {
        this.queue = queue;
        this.store = store;
        this.coordinator = coordinator;
        this.coordinatorRunning = coordinatorRunning;
        this.clock = clock;
    }

    public QueueMetrics depth() throws QueueException {
        return queue.getMetrics();
    }

    public long liveWorkerCount() {
        return coordinator.listLiveWorkers().size();
    }

    public long deadWorkerCount() {
        return coordinator.listWorkers().stream().filter(worker -> !worker.isLive()).count();
    }

    public List<ExecutionRecord> records(String jobId) throws TransientStoreException {
        return store.listRecords(jobId);
    }

    public List<ExecutionRecord> records(long fromMs, long toMs, int limit) throws TransientStoreException {
        return store.listRecords(fromMs, toMs, limit);
    }

    /**
     * Snapshot of depth, workers and the {@code recentLimit} latest executions.
     */
    public MonitorReport report(int recentLimit) throws QueueException {
        if (recentLimit < 0) {
            throw new IllegalArgumentException("recentLimit must not be negative");
        }
        QueueMetrics metrics = queue.getMetrics();
        List<WorkerRecord> workers = coordinator.listWorkers();
        long live = workers.stream().filter(WorkerRecord::isLive).count();
        List<ExecutionRecord> recent = store.listRecentRecords(recentLimit);

        Map<String, Long> perWorker = new TreeMap<>();
        for (ExecutionRecord record : recent) {
            if (record.workerId() != null) {
                perWorker.merge(record.workerId(), 1L, Long::sum);
            }
        }

        return new MonitorReport(clock.millis(), metrics.asMap(), workers, live, workers.size() - live,
                perWorker, recent, readiness());
    }

    public HealthStatus liveness() {
        return new HealthStatus(coordinatorRunning.getAsBoolean(), store.isReachable());
    }

    public HealthStatus.Readiness readiness() {
        return queue.isDraining() ? HealthStatus.Readiness.DRAINING : HealthStatus.Readiness.ACCEPTING;
    }
}
