package com.umitunal.qdispatch.core;

import java.util.EnumMap;
import java.util.Map;

/**
 * Queue depth per job state.
 */
public class QueueMetrics {
    private final long waitingJobs;
    private final long activeJobs;
    private final long delayedJobs;
    private final long completedJobs;
    private final long failedJobs;

    public QueueMetrics(long waitingJobs, long activeJobs, long delayedJobs,
                        long completedJobs, long failedJobs) {
        this.waitingJobs = waitingJobs;
        this.activeJobs = activeJobs;
        this.delayedJobs = delayedJobs;
        this.completedJobs = completedJobs;
        this.failedJobs = failedJobs;
    }

    public long getTotalJobs() {
        return waitingJobs + activeJobs + delayedJobs + completedJobs + failedJobs;
    }

    public long getWaitingJobs() { return waitingJobs; }
    public long getActiveJobs() { return activeJobs; }
    public long getDelayedJobs() { return delayedJobs; }
    public long getCompletedJobs() { return completedJobs; }
    public long getFailedJobs() { return failedJobs; }

    public long count(JobState state) {
        return switch (state) {
            case WAITING -> waitingJobs;
            case ACTIVE -> activeJobs;
            case DELAYED -> delayedJobs;
            case COMPLETED -> completedJobs;
            case FAILED -> failedJobs;
        };
    }

    public Map<JobState, Long> asMap() {
        Map<JobState, Long> depth = new EnumMap<>(JobState.class);
        for (JobState state : JobState.values()) {
            depth.put(state, count(state));
        }
        return depth;
    }

    @Override
    public String toString() {
        return String.format(
            "QueueMetrics{total=%d, waiting=%d, active=%d, delayed=%d, completed=%d, failed=%d}",
            getTotalJobs(), waitingJobs, activeJobs, delayedJobs, completedJobs, failedJobs
        );
    }
}
