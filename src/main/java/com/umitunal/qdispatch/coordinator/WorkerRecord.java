package com.umitunal.qdispatch.coordinator;

/**
 * Coordinator's view of one worker. Immutable; updates produce a new record.
 *
 * @param workerId        worker identity
 * @param registeredAt    registration time, millis since epoch
 * @param lastHeartbeatAt last heartbeat (or registration) time, millis since epoch
 * @param status          current liveness and activity
 */
public record WorkerRecord(String workerId, long registeredAt, long lastHeartbeatAt, WorkerStatus status) {

    public static WorkerRecord registered(String workerId, long now) {
        return new WorkerRecord(workerId, now, now, WorkerStatus.IDLE);
    }

    public WorkerRecord withHeartbeat(long now) {
        return new WorkerRecord(workerId, registeredAt, Math.max(lastHeartbeatAt, now), status);
    }

    public WorkerRecord withStatus(WorkerStatus newStatus) {
        return new WorkerRecord(workerId, registeredAt, lastHeartbeatAt, newStatus);
    }

    public boolean isLive() {
        return status != WorkerStatus.DEAD;
    }

    /**
     * Silent for longer than the liveness window.
     */
    public boolean isStale(long now, long livenessWindow) {
        return now - lastHeartbeatAt > livenessWindow;
    }
}
