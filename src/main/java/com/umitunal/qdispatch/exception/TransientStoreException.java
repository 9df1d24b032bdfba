package com.umitunal.qdispatch.exception;

/**
 * Storage backend hiccup. The operation had no effect and may be retried.
 */
public class TransientStoreException extends QueueException {

    public TransientStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public TransientStoreException(String message) {
        super(message);
    }
}
