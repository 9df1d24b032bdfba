package com.umitunal.qdispatch.exception;

/**
 * Base type for errors raised by the queue, store and coordinator.
 */
public class QueueException extends Exception {

    public QueueException(String message) {
        super(message);
    }

    public QueueException(String message, Throwable cause) {
        super(message, cause);
    }
}
