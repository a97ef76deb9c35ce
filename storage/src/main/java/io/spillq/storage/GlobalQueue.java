// file: storage/src/main/java/io/spillq/storage/GlobalQueue.java
package io.spillq.storage;

import io.spillq.core.PopStatus;
import io.spillq.core.RecordLines;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/**
 * Process-wide queue with a path-per-call surface.
 * <p>
 * Semantics:
 *  - One memory ring for the whole process, shared by every caller no
 *    matter which path they pass. The path only selects the backing file
 *    a spill writes to or a disk pop reads from.
 *  - initLock() must run before any other call; teardownLock() drops the
 *    ring and the lock state and must only run once nothing is in flight.
 *  - Every call runs to completion holding one global lock.
 * <p>
 * New code should prefer one HybridQueue per backing file.
 */
public final class GlobalQueue {
    private static final Logger log = Logger.getLogger(GlobalQueue.class.getName());

    private static final ReentrantLock LOCK = new ReentrantLock();
    private static final QueueMetrics METRICS = new QueueMetrics();

    // guarded by LOCK; null when not initialised
    private static HybridEngine engine;

    private GlobalQueue() {
        // static facade
    }

    /** Initialise with the default ring size and STRICT_FIFO ordering. */
    public static void initLock() {
        initLock(QueueConfig.DEFAULT_RING_CAPACITY, SpillOrdering.STRICT_FIFO);
    }

    public static void initLock(int ringCapacity, SpillOrdering ordering) {
        Objects.requireNonNull(ordering, "ordering");
        LOCK.lock();
        try {
            if (engine != null) throw new IllegalStateException("global queue already initialised");
            engine = new HybridEngine(ringCapacity, ordering, QueueConfig.DEFAULT_MAX_RECORD_LENGTH, METRICS);
            log.info(() -> "Global queue initialised (ring=" + ringCapacity + ", ordering=" + ordering + ")");
        } finally {
            LOCK.unlock();
        }
    }

    /** Release the global state. In-memory records are dropped. No-op if not initialised. */
    public static void teardownLock() {
        LOCK.lock();
        try {
            if (engine == null) return;
            int dropped = engine.discard();
            engine = null;
            log.info(() -> "Global queue torn down; dropped " + dropped + " in-memory records");
        } finally {
            LOCK.unlock();
        }
    }

    public static void push(Path path, String item) {
        RecordLines.requireLineSafe(item);
        BackingStore store = storeFor(path);
        LOCK.lock();
        try {
            requireInit().push(store, item);
        } finally {
            LOCK.unlock();
        }
    }

    /**
     * Pop into out: at most capacity - 1 characters plus '\0'.
     * capacity must be between 1 and out.length.
     */
    public static PopStatus pop(Path path, char[] out, int capacity) {
        Objects.requireNonNull(out, "out");
        if (capacity < 1 || capacity > out.length) {
            throw new IllegalArgumentException("capacity must be in [1, " + out.length + "], got: " + capacity);
        }
        BackingStore store = storeFor(path);
        Optional<String> next;
        LOCK.lock();
        try {
            next = requireInit().pop(store);
        } finally {
            LOCK.unlock();
        }
        if (next.isEmpty()) return PopStatus.EMPTY;
        RecordLines.copyInto(next.get(), out, capacity);
        return PopStatus.RETRIEVED;
    }

    public static long length(Path path) {
        BackingStore store = storeFor(path);
        LOCK.lock();
        try {
            return requireInit().length(store);
        } finally {
            LOCK.unlock();
        }
    }

    /** Counters accumulated since class load (across init/teardown cycles). */
    public static QueueMetrics metrics() {
        return METRICS;
    }

    private static BackingStore storeFor(Path path) {
        return new LineFileBackingStore(Objects.requireNonNull(path, "path"), false);
    }

    private static HybridEngine requireInit() {
        if (engine == null) throw new IllegalStateException("global queue not initialised; call initLock() first");
        return engine;
    }
}
