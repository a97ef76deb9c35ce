// file: storage/src/main/java/io/spillq/storage/HybridQueue.java
package io.spillq.storage;

import io.spillq.core.PopStatus;
import io.spillq.core.RecordLines;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Hybrid RAM + disk FIFO queue.
 * <p>
 * Responsibilities:
 *  - Keep recent records in a bounded memory ring.
 *  - When the ring is full, spill all of it to a line-delimited backing file.
 *  - When memory has nothing to give, pop the oldest line from the file and
 *    rewrite the remainder (atomic replace).
 * <p>
 * Concurrency:
 *  - One lock per queue serializes push, pop, length, flush and close,
 *    including all file I/O. A slow disk pop blocks every other caller.
 *  - Nothing protects the file from other processes or other queue
 *    instances: a backing file must have exactly one owner.
 * <p>
 * Lifecycle:
 *  - The constructor initialises the lock; the queue is usable immediately.
 *  - close() tears it down. Records still in memory are spilled first if
 *    flushOnClose is set, otherwise dropped. Any call after close() throws
 *    IllegalStateException.
 */
public final class HybridQueue implements AutoCloseable {
    private static final Logger log = Logger.getLogger(HybridQueue.class.getName());

    private final QueueConfig config;
    private final BackingStore store;
    private final QueueMetrics metrics = new QueueMetrics();
    private final HybridEngine engine;
    private final ReentrantLock lock = new ReentrantLock();

    // guarded by lock
    private boolean closed = false;

    public HybridQueue(QueueConfig config) {
        this(config, new LineFileBackingStore(config.path(), config.fsync()));
    }

    public HybridQueue(QueueConfig config, BackingStore store) {
        this.config = Objects.requireNonNull(config, "config");
        this.store = Objects.requireNonNull(store, "store");
        this.engine = new HybridEngine(config.ringCapacity(), config.ordering(), config.maxRecordLength(), metrics);
        log.info(() -> "Opened queue on " + store.path() + " (ring=" + config.ringCapacity()
                + ", ordering=" + config.ordering() + ")");
    }

    /**
     * Enqueue a record.
     *
     * @throws IllegalArgumentException          if the record contains '\n'
     * @throws io.spillq.core.QueueIoException   if a required spill failed (nothing was enqueued)
     * @throws io.spillq.core.QueueInconsistencyException if the ring stayed full after a spill
     */
    public void push(String record) {
        RecordLines.requireLineSafe(record);
        lock.lock();
        try {
            ensureOpen();
            engine.push(store, record);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Push records in order under a single lock hold, so no other caller's
     * records interleave. Stops at the first failure; earlier records stay queued.
     */
    public void pushBatch(Iterable<String> records) {
        Objects.requireNonNull(records, "records");
        lock.lock();
        try {
            for (String r : records) {
                push(r);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Dequeue the next record, truncated to maxRecordLength characters.
     *
     * @return the record, or empty if neither memory nor disk holds one
     */
    public Optional<String> pop() {
        lock.lock();
        try {
            ensureOpen();
            return engine.pop(store);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Dequeue into a caller buffer: at most buffer.length - 1 characters plus
     * a '\0' terminator. Longer records are cut without notice. On EMPTY the
     * buffer is not touched.
     */
    public PopStatus pop(char[] buffer) {
        Objects.requireNonNull(buffer, "buffer");
        if (buffer.length < 1) throw new IllegalArgumentException("buffer must hold at least the terminator");
        Optional<String> next = pop();
        if (next.isEmpty()) return PopStatus.EMPTY;
        RecordLines.copyInto(next.get(), buffer);
        return PopStatus.RETRIEVED;
    }

    /** Pop up to n records, stopping early when the queue runs dry. */
    public List<String> popBatch(int n) {
        if (n < 0) throw new IllegalArgumentException("n must be >= 0, got: " + n);
        lock.lock();
        try {
            List<String> out = new ArrayList<>(Math.min(n, 1024));
            for (int i = 0; i < n; i++) {
                Optional<String> next = pop();
                if (next.isEmpty()) break;
                out.add(next.get());
            }
            return out;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records in memory plus line terminators in the backing file.
     * Scans the whole file on every call; keep it off hot paths.
     */
    public long length() {
        lock.lock();
        try {
            ensureOpen();
            return engine.length(store);
        } finally {
            lock.unlock();
        }
    }

    /** Spill everything currently in memory. Returns the number of records written. */
    public int flush() {
        lock.lock();
        try {
            ensureOpen();
            return engine.flush(store);
        } finally {
            lock.unlock();
        }
    }

    /** Records currently held in the memory ring. */
    public int inMemory() {
        lock.lock();
        try {
            return engine.inMemory();
        } finally {
            lock.unlock();
        }
    }

    public QueueConfig config() {
        return config;
    }

    public QueueMetrics metrics() {
        return metrics;
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Tear the queue down. Idempotent. Only call once no other operation is
     * in flight. If the flush-on-close spill fails the queue stays open and
     * the exception propagates.
     */
    @Override
    public void close() {
        lock.lock();
        try {
            if (closed) return;
            if (config.flushOnClose()) {
                engine.flush(store);
            }
            int dropped = engine.discard();
            closed = true;
            if (dropped > 0) {
                log.log(Level.WARNING, "Closed queue on {0}; dropped {1} in-memory records",
                        new Object[]{store.path(), dropped});
            } else {
                log.info(() -> "Closed queue on " + store.path() + " " + metrics);
            }
        } finally {
            lock.unlock();
        }
    }

    private void ensureOpen() {
        if (closed) throw new IllegalStateException("queue on " + store.path() + " is closed");
    }
}
