package io.spillq.core;

/**
 * Base type for failures surfaced by the hybrid queue.
 * Unchecked, like the rest of the storage layer's failures.
 */
public class QueueException extends RuntimeException {

    public QueueException(String message) {
        super(message);
    }

    public QueueException(String message, Throwable cause) {
        super(message, cause);
    }
}
