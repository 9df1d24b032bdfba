package com.umitunal.qdispatch.monitor;

/**
 * Result of a liveness probe.
 *
 * @param coordinator whether maintenance (and with it dead worker detection) is running
 * @param queue       whether the durable store answered a read
 */
public record HealthStatus(boolean coordinator, boolean queue) {

    public boolean isLive() {
        return coordinator && queue;
    }

    /**
     * Whether the engine takes new jobs.
     */
    public enum Readiness {
        ACCEPTING,
        DRAINING
    }
}
