package com.umitunal.qdispatch.exception;

/**
 * The queue is draining and no longer accepts new jobs.
 */
public class QueueDrainingException extends QueueException {

    public QueueDrainingException() {
        super("Queue is draining and not accepting new jobs");
    }
}
