// file: core/src/main/java/io/spillq/core/RecordLines.java
package io.spillq.core;

import java.nio.charset.CharsetEncoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Rules for records stored in a line-delimited backing file.
 * <p>
 * Format:
 *   - one record per line, UTF-8,
 *   - exactly one '\n' after every record,
 *   - no header, no length prefix, no checksum.
 * <p>
 * A record therefore must not contain '\n', and must be well-formed UTF-16
 * (no unpaired surrogates) so it survives the trip through UTF-8. Any other
 * character (including '\r') is stored as-is.
 */
public final class RecordLines {
    public static final char TERMINATOR = '\n';

    private RecordLines() {
        // utility
    }

    /**
     * Reject null records and records that would break the line format.
     *
     * @return the record itself, for chaining
     */
    public static String requireLineSafe(String record) {
        Objects.requireNonNull(record, "record");
        if (record.indexOf(TERMINATOR) >= 0) {
            throw new IllegalArgumentException(
                    "record must not contain a line terminator (length=" + record.length() + ")");
        }
        if (!strictUtf8().canEncode(record)) {
            throw new IllegalArgumentException(
                    "record is not valid UTF-16, it has an unpaired surrogate (length=" + record.length() + ")");
        }
        return record;
    }

    // encoders are stateful, so one per call
    private static CharsetEncoder strictUtf8() {
        return StandardCharsets.UTF_8.newEncoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
    }

    /** Cut a record down to at most maxLength characters. */
    public static String truncate(String record, int maxLength) {
        if (maxLength < 0) throw new IllegalArgumentException("maxLength must be >= 0");
        return record.length() <= maxLength ? record : record.substring(0, maxLength);
    }

    /**
     * Copy a record into a C-style buffer: at most buffer.length - 1 chars,
     * followed by a '\0' terminator. Longer records are silently truncated.
     *
     * @return number of characters copied (not counting the terminator)
     */
    public static int copyInto(String record, char[] buffer) {
        Objects.requireNonNull(buffer, "buffer");
        return copyInto(record, buffer, buffer.length);
    }

    /** Same as copyInto(record, buffer) but only uses the first capacity slots. */
    public static int copyInto(String record, char[] buffer, int capacity) {
        Objects.requireNonNull(buffer, "buffer");
        if (capacity < 1) throw new IllegalArgumentException("buffer must hold at least the terminator");
        if (capacity > buffer.length) throw new IllegalArgumentException("capacity exceeds buffer length");
        int n = Math.min(record.length(), capacity - 1);
        record.getChars(0, n, buffer, 0);
        buffer[n] = '\0';
        return n;
    }

    /** Read back a '\0'-terminated buffer written by copyInto. */
    public static String fromBuffer(char[] buffer) {
        int end = 0;
        while (end < buffer.length && buffer[end] != '\0') end++;
        return new String(buffer, 0, end);
    }
}
