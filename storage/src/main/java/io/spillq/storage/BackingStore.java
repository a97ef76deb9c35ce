// file: storage/src/main/java/io/spillq/storage/BackingStore.java
package io.spillq.storage;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Overflow storage behind the in-memory ring.
 * <p>
 * Contract:
 *  - Records come back out of popFirst() in the order they went into append().
 *  - A store whose file does not exist is an empty store, not an error.
 *  - Failures surface as QueueIoException; implementations never retry.
 *  - Not thread-safe and not safe across processes: exactly one queue may
 *    own a given store at a time.
 */
public interface BackingStore {

    /** Location of the store (used in log and error messages). */
    Path path();

    /**
     * Append records in order, one line each.
     * <p>
     * Either every record is appended or the call throws. On failure the
     * implementation tries to cut the file back to its previous length so a
     * retry does not duplicate records.
     */
    void append(List<String> records);

    /**
     * Remove and return the oldest record, rewriting the remainder.
     * The remainder must be replaced atomically: a failed or interrupted
     * rewrite leaves the previous contents in place.
     *
     * @return the oldest record, or empty if the store holds none.
     */
    Optional<String> popFirst();

    /** Number of complete records (line terminators) in the store. */
    long countRecords();

    /** Cheap check for "anything on disk", without scanning. */
    boolean hasRecords();
}
