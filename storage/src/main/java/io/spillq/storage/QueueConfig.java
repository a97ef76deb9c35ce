// file: storage/src/main/java/io/spillq/storage/QueueConfig.java
package io.spillq.storage;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.spillq.storage.dto.QueueJsonConfig;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Per-queue configuration.
 *
 * Fields:
 *  - path:            backing file that receives spilled records
 *  - ringCapacity:    slots in the memory ring (holds ringCapacity - 1 records)
 *  - maxRecordLength: pops return at most this many characters per record
 *  - ordering:        behaviour across a spill boundary, see SpillOrdering
 *  - fsync:           force file contents to the device after every spill/rewrite
 *  - flushOnClose:    spill whatever is still in memory when the queue is closed
 */
public record QueueConfig(
        Path path,
        int ringCapacity,
        int maxRecordLength,
        SpillOrdering ordering,
        boolean fsync,
        boolean flushOnClose
) {
    public static final int DEFAULT_RING_CAPACITY = 10_000;
    /** 4096-char line buffer minus its terminator. */
    public static final int DEFAULT_MAX_RECORD_LENGTH = 4095;

    public QueueConfig {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(ordering, "ordering");
        if (ringCapacity < 2) throw new IllegalArgumentException("ringCapacity must be >= 2, got: " + ringCapacity);
        if (maxRecordLength < 1) throw new IllegalArgumentException("maxRecordLength must be >= 1, got: " + maxRecordLength);
    }

    public static QueueConfig defaults(Path path) {
        return new QueueConfig(path, DEFAULT_RING_CAPACITY, DEFAULT_MAX_RECORD_LENGTH,
                SpillOrdering.STRICT_FIFO, false, false);
    }

    public QueueConfig withPath(Path p) {
        return new QueueConfig(p, ringCapacity, maxRecordLength, ordering, fsync, flushOnClose);
    }

    public QueueConfig withRingCapacity(int capacity) {
        return new QueueConfig(path, capacity, maxRecordLength, ordering, fsync, flushOnClose);
    }

    public QueueConfig withMaxRecordLength(int max) {
        return new QueueConfig(path, ringCapacity, max, ordering, fsync, flushOnClose);
    }

    public QueueConfig withOrdering(SpillOrdering o) {
        return new QueueConfig(path, ringCapacity, maxRecordLength, o, fsync, flushOnClose);
    }

    public QueueConfig withFsync(boolean f) {
        return new QueueConfig(path, ringCapacity, maxRecordLength, ordering, f, flushOnClose);
    }

    public QueueConfig withFlushOnClose(boolean f) {
        return new QueueConfig(path, ringCapacity, maxRecordLength, ordering, fsync, f);
    }

    /**
     * Load a config from JSON. Missing fields take the defaults; unknown
     * fields are rejected. A relative "path" is resolved against the
     * directory of the JSON file.
     *
     * <pre>
     * {
     *   "path": "queue.txt",
     *   "ringCapacity": 10000,
     *   "maxRecordLength": 4095,
     *   "ordering": "STRICT_FIFO",
     *   "fsync": false,
     *   "flushOnClose": true
     * }
     * </pre>
     */
    public static QueueConfig fromJsonFile(Path file) {
        ObjectMapper mapper = new ObjectMapper()
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        QueueJsonConfig cfg;
        try {
            cfg = mapper.readValue(file.toFile(), QueueJsonConfig.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load QueueConfig from " + file, e);
        }
        if (cfg.path == null || cfg.path.isBlank()) {
            throw new IllegalArgumentException("\"path\" is required in " + file);
        }

        Path p = Path.of(cfg.path);
        if (!p.isAbsolute()) {
            Path base = file.toAbsolutePath().getParent();
            p = base == null ? p : base.resolve(p);
        }

        return new QueueConfig(
                p,
                cfg.ringCapacity != null ? cfg.ringCapacity : DEFAULT_RING_CAPACITY,
                cfg.maxRecordLength != null ? cfg.maxRecordLength : DEFAULT_MAX_RECORD_LENGTH,
                cfg.ordering != null ? cfg.ordering : SpillOrdering.STRICT_FIFO,
                cfg.fsync != null && cfg.fsync,
                cfg.flushOnClose != null && cfg.flushOnClose
        );
    }
}
