// file: storage/src/main/java/io/spillq/storage/HybridEngine.java
package io.spillq.storage;

import io.spillq.core.MemoryRing;
import io.spillq.core.PushOutcome;
import io.spillq.core.QueueInconsistencyException;
import io.spillq.core.QueueIoException;
import io.spillq.core.RecordLines;

import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Ring + spill + compaction logic shared by HybridQueue and GlobalQueue.
 * <p>
 * push:
 *   1) offer to the ring (fast path, O(1)).
 *   2) on Full, spill the whole ring to the store, then:
 *        - SPILL_NEWEST_FIRST: retry the ring once,
 *        - STRICT_FIFO:        the record is appended in the same spill batch.
 * <p>
 * pop:
 *   - ring first, store second;
 *   - under STRICT_FIFO the store goes first whenever it holds records.
 * <p>
 * A spill clears the ring only after the store accepted every record,
 * so a failed spill loses nothing.
 * <p>
 * Not thread-safe: callers hold their own lock around every call.
 */
final class HybridEngine {
    private static final Logger log = Logger.getLogger(HybridEngine.class.getName());

    private final MemoryRing ring;
    private final SpillOrdering ordering;
    private final int maxRecordLength;
    private final QueueMetrics metrics;

    HybridEngine(int ringCapacity, SpillOrdering ordering, int maxRecordLength, QueueMetrics metrics) {
        this.ring = new MemoryRing(ringCapacity);
        this.ordering = ordering;
        this.maxRecordLength = maxRecordLength;
        this.metrics = metrics;
    }

    void push(BackingStore store, String record) {
        PushOutcome outcome = ring.offer(record);
        if (outcome instanceof PushOutcome.Full) {
            switch (ordering) {
                case STRICT_FIFO -> spill(store, record);
                case SPILL_NEWEST_FIRST -> {
                    spill(store, null);
                    if (ring.offer(record) instanceof PushOutcome.Full full) {
                        throw new QueueInconsistencyException(
                                "ring still full after spill (occupancy=" + full.occupancy()
                                        + ", capacity=" + full.capacity() + ")");
                    }
                }
            }
        }
        metrics.recordPush();
    }

    Optional<String> pop(BackingStore store) {
        if (ordering == SpillOrdering.STRICT_FIFO && store.hasRecords()) {
            return popFromStore(store);
        }
        String fromRing = ring.poll();
        if (fromRing != null) {
            metrics.recordMemoryPop();
            return Optional.of(limit(fromRing));
        }
        return popFromStore(store);
    }

    long length(BackingStore store) {
        return ring.size() + store.countRecords();
    }

    /** Spill whatever is in memory now. Returns the number of records written. */
    int flush(BackingStore store) {
        if (ring.isEmpty()) return 0;
        return spill(store, null);
    }

    int inMemory() {
        return ring.size();
    }

    /** Drop the ring contents. Returns how many records were dropped. */
    int discard() {
        int dropped = ring.size();
        ring.clear();
        return dropped;
    }

    /**
     * Write ring contents (plus an optional trailing record) to the store,
     * then clear the ring.
     */
    private int spill(BackingStore store, String trailing) {
        List<String> batch = ring.snapshot();
        if (trailing != null) batch.add(trailing);

        try {
            store.append(batch);
        } catch (QueueIoException e) {
            metrics.recordSpillFailure();
            log.log(Level.WARNING, "Spill of " + batch.size() + " records to " + store.path()
                    + " failed; memory ring left intact", e);
            throw e;
        }

        ring.clear();
        metrics.recordSpill(batch.size());
        log.fine(() -> "Spilled " + batch.size() + " records to " + store.path());
        return batch.size();
    }

    private Optional<String> popFromStore(BackingStore store) {
        Optional<String> fromStore = store.popFirst();
        if (fromStore.isPresent()) {
            metrics.recordDiskPop();
            log.fine(() -> "Compacted " + store.path() + " after disk pop");
            return fromStore.map(this::limit);
        }
        metrics.recordEmptyPop();
        return Optional.empty();
    }

    private String limit(String record) {
        if (record.length() <= maxRecordLength) return record;
        metrics.recordTruncatedPop();
        return RecordLines.truncate(record, maxRecordLength);
    }
}
