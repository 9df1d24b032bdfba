package com.umitunal.qdispatch.monitor;

import com.umitunal.qdispatch.coordinator.WorkerRecord;
import com.umitunal.qdispatch.core.ExecutionRecord;
import com.umitunal.qdispatch.core.JobState;

import java.util.List;
import java.util.Map;

/**
 * Point-in-time view of the engine: queue depth, workers and the latest executions.
 *
 * @param generatedAt         when the report was taken (epoch millis)
 * @param depth               job count per state
 * @param workers             every known worker, dead ones included
 * @param liveWorkers         number of workers not declared dead
 * @param deadWorkers         number of workers declared dead
 * @param executionsPerWorker how the recent executions were spread across workers
 * @param recentExecutions    the latest execution records, newest first
 * @param readiness           whether new jobs are accepted
 */
public record MonitorReport(
        long generatedAt,
        Map<JobState, Long> depth,
        List<WorkerRecord> workers,
        long liveWorkers,
        long deadWorkers,
        Map<String, Long> executionsPerWorker,
        List<ExecutionRecord> recentExecutions,
        HealthStatus.Readiness readiness
) {

    public long totalJobs() {
        return depth.values().stream().mapToLong(Long::longValue).sum();
    }
}
