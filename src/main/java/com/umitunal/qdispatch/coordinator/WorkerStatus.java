package com.umitunal.qdispatch.coordinator;

public enum WorkerStatus {
    IDLE,
    BUSY,
    DEAD
}
