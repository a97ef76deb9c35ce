package io.spillq.core;

/**
 * Internal invariant violated, e.g. the ring still reports Full right after
 * a successful spill. Indicates a bug; callers should not try to recover.
 */
public class QueueInconsistencyException extends QueueException {

    public QueueInconsistencyException(String message) {
        super(message);
    }
}
