package io.spillq.storage;

import io.spillq.core.PopStatus;
import io.spillq.core.QueueIoException;
import io.spillq.core.RecordLines;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class HybridQueueTest {

    @TempDir Path dir;

    private Path file;

    @BeforeEach
    void setUp() {
        file = dir.resolve("spill.txt");
    }

    private QueueConfig cfg(int ringCapacity, SpillOrdering ordering) {
        return QueueConfig.defaults(file).withRingCapacity(ringCapacity).withOrdering(ordering);
    }

    private static List<String> drain(HybridQueue q) {
        List<String> out = new ArrayList<>();
        for (Optional<String> next; (next = q.pop()).isPresent(); ) {
            out.add(next.get());
        }
        return out;
    }

    @Test
    void length_counts_pushes_that_fit_in_memory_without_touching_disk() {
        try (var q = new HybridQueue(cfg(5, SpillOrdering.STRICT_FIFO))) {
            for (int i = 1; i <= 4; i++) {
                q.push("item-" + i);
                assertEquals(i, q.length());
            }
            assertEquals(0, q.metrics().spills());
            assertFalse(Files.exists(file));
        }
    }

    @Test
    void one_push_past_the_ring_spills_exactly_once_and_loses_nothing() {
        try (var q = new HybridQueue(cfg(4, SpillOrdering.STRICT_FIFO))) {
            for (int i = 1; i <= 4; i++) q.push(Integer.toString(i));

            assertEquals(1, q.metrics().spills());
            assertEquals(4, q.metrics().recordsSpilled(), "trigger record joins the spilled batch");
            assertEquals(0, q.inMemory());
            assertEquals(4, q.length());
        }
    }

    @Test
    void newest_first_policy_spills_the_old_ring_and_keeps_the_trigger_in_memory() {
        try (var q = new HybridQueue(cfg(4, SpillOrdering.SPILL_NEWEST_FIRST))) {
            for (int i = 1; i <= 4; i++) q.push(Integer.toString(i));

            assertEquals(1, q.metrics().spills());
            assertEquals(3, q.metrics().recordsSpilled());
            assertEquals(1, q.inMemory());
            assertEquals(4, q.length());
        }
    }

    @Test
    void round_trip_preserves_every_character_except_the_terminator() {
        String tricky = "tab\there cr\r quote\" backslash\\ nul\0 unicode ✓ 日本";
        try (var q = new HybridQueue(cfg(8, SpillOrdering.STRICT_FIFO))) {
            q.push(tricky);
            assertEquals(Optional.of(tricky), q.pop());
        }
    }

    @Test
    void strict_fifo_preserves_order_across_a_spill_boundary() {
        try (var q = new HybridQueue(cfg(4, SpillOrdering.STRICT_FIFO))) {
            for (int i = 1; i <= 6; i++) q.push(Integer.toString(i)); // 1..4 on disk, 5..6 in memory

            assertEquals(List.of("1", "2", "3", "4", "5", "6"), drain(q));
            assertEquals(Optional.empty(), q.pop());
        }
    }

    @Test
    void newest_first_policy_returns_the_trigger_before_spilled_records() {
        try (var q = new HybridQueue(cfg(4, SpillOrdering.SPILL_NEWEST_FIRST))) {
            for (int i = 1; i <= 4; i++) q.push(Integer.toString(i)); // 1..3 on disk, 4 in memory

            assertEquals(List.of("4", "1", "2", "3"), drain(q));
            assertEquals(1, q.metrics().memoryPops());
            assertEquals(3, q.metrics().diskPops());
        }
    }

    @Test
    void disk_pops_compact_the_file_one_record_at_a_time() throws Exception {
        try (var q = new HybridQueue(cfg(4, SpillOrdering.STRICT_FIFO))) {
            List<String> remaining = new ArrayList<>();
            for (int i = 1; i <= 8; i++) {
                q.push("rec-" + i);
                remaining.add("rec-" + i);
            }
            assertEquals(0, q.inMemory(), "two spills moved everything to disk");
            assertEquals(remaining, Files.readAllLines(file));

            while (!remaining.isEmpty()) {
                assertEquals(Optional.of(remaining.remove(0)), q.pop());
                assertEquals(remaining, Files.readAllLines(file));
            }
            assertEquals(Optional.empty(), q.pop());
            assertEquals(1, q.metrics().emptyPops());
        }
    }

    @Test
    void failed_spill_aborts_the_push_and_keeps_memory_intact() {
        var store = new FlakyBackingStore(file);
        try (var q = new HybridQueue(cfg(3, SpillOrdering.STRICT_FIFO), store)) {
            q.push("a");
            q.push("b");

            assertEquals(0, store.appendCalls);

            store.failAppends = true;
            var e = assertThrows(QueueIoException.class, () -> q.push("c"));
            assertEquals(1, store.appendCalls);
            assertEquals(file, e.path());
            assertEquals(2, q.inMemory());
            assertEquals(2, q.length());
            assertEquals(1, q.metrics().spillFailures());
            assertEquals(0, q.metrics().spills());

            store.failAppends = false;
            q.push("c");
            assertEquals(2, store.appendCalls);
            assertEquals(List.of("a", "b", "c"), drain(q));
        }
    }

    @Test
    void record_with_line_terminator_is_rejected_before_any_state_change() {
        try (var q = new HybridQueue(cfg(4, SpillOrdering.STRICT_FIFO))) {
            assertThrows(IllegalArgumentException.class, () -> q.push("two\nlines"));
            assertThrows(NullPointerException.class, () -> q.push(null));
            assertEquals(0, q.length());
            assertEquals(0, q.metrics().pushes());
        }
    }

    @Test
    void record_with_unpaired_surrogate_is_rejected_before_any_state_change() {
        try (var q = new HybridQueue(cfg(4, SpillOrdering.STRICT_FIFO))) {
            assertThrows(IllegalArgumentException.class, () -> q.push("a\uD800b"));
            assertEquals(0, q.length());

            String pair = "a\uD83D\uDE00b";
            q.push(pair);
            q.flush();
            assertEquals(Optional.of(pair), q.pop(), "valid surrogate pairs survive the file");
        }
    }

    @Test
    void spill_after_a_torn_line_does_not_merge_records() throws Exception {
        Files.writeString(file, "one\ntwo");
        try (var q = new HybridQueue(cfg(2, SpillOrdering.STRICT_FIFO))) {
            q.push("x");
            q.push("y");

            assertEquals(List.of("one", "two", "x", "y"), drain(q));
        }
    }

    @Test
    void long_records_are_truncated_on_pop_from_memory_and_from_disk() {
        var config = cfg(2, SpillOrdering.STRICT_FIFO).withMaxRecordLength(5);
        try (var q = new HybridQueue(config)) {
            q.push("abcdefgh");
            assertEquals(Optional.of("abcde"), q.pop());

            q.push("0123456789");
            q.push("x"); // ring of 2 holds one record; this spills both
            assertEquals(Optional.of("01234"), q.pop());
            assertEquals(Optional.of("x"), q.pop());
            assertEquals(2, q.metrics().truncatedPops());
        }
    }

    @Test
    void pop_into_buffer_truncates_silently_and_leaves_buffer_alone_when_empty() {
        try (var q = new HybridQueue(cfg(4, SpillOrdering.STRICT_FIFO))) {
            q.push("hello");

            char[] buf = new char[4];
            assertEquals(PopStatus.RETRIEVED, q.pop(buf));
            assertEquals("hel", RecordLines.fromBuffer(buf));

            char[] untouched = new char[8];
            Arrays.fill(untouched, 'z');
            assertEquals(PopStatus.EMPTY, q.pop(untouched));
            for (char c : untouched) assertEquals('z', c);

            assertThrows(IllegalArgumentException.class, () -> q.pop(new char[0]));
        }
    }

    @Test
    void invalid_buffer_does_not_consume_a_record() {
        try (var q = new HybridQueue(cfg(4, SpillOrdering.STRICT_FIFO))) {
            q.push("keep");
            assertThrows(IllegalArgumentException.class, () -> q.pop(new char[0]));
            assertEquals(Optional.of("keep"), q.pop());
        }
    }

    @Test
    void closed_queue_rejects_operations_and_close_is_idempotent() {
        var q = new HybridQueue(cfg(4, SpillOrdering.STRICT_FIFO));
        q.close();

        assertTrue(q.isClosed());
        assertThrows(IllegalStateException.class, () -> q.push("x"));
        assertThrows(IllegalStateException.class, q::pop);
        assertThrows(IllegalStateException.class, q::length);
        assertThrows(IllegalStateException.class, q::flush);
        assertDoesNotThrow(q::close);
    }

    @Test
    void flush_on_close_persists_memory_for_the_next_owner() throws Exception {
        var config = cfg(8, SpillOrdering.STRICT_FIFO).withFlushOnClose(true);
        try (var q = new HybridQueue(config)) {
            q.push("a");
            q.push("b");
        }
        assertEquals(List.of("a", "b"), Files.readAllLines(file));

        try (var reopened = new HybridQueue(config)) {
            assertEquals(2, reopened.length());
            assertEquals(List.of("a", "b"), drain(reopened));
        }
    }

    @Test
    void close_without_flush_drops_memory() {
        var q = new HybridQueue(cfg(8, SpillOrdering.STRICT_FIFO));
        q.push("volatile");
        q.close();

        assertFalse(Files.exists(file));
    }

    @Test
    void flush_spills_on_demand() {
        try (var q = new HybridQueue(cfg(8, SpillOrdering.STRICT_FIFO))) {
            q.push("a");
            q.push("b");

            assertEquals(2, q.flush());
            assertEquals(0, q.flush(), "nothing left to flush");
            assertEquals(0, q.inMemory());
            assertEquals(2, q.length());
        }
    }

    @Test
    void batch_helpers_push_in_order_and_stop_popping_when_dry() {
        try (var q = new HybridQueue(cfg(4, SpillOrdering.STRICT_FIFO))) {
            q.pushBatch(List.of("a", "b", "c", "d", "e"));

            assertEquals(List.of("a", "b"), q.popBatch(2));
            assertEquals(List.of("c", "d", "e"), q.popBatch(10));
            assertEquals(List.of(), q.popBatch(3));
            assertThrows(IllegalArgumentException.class, () -> q.popBatch(-1));
        }
    }

    @Test
    void push_batch_stops_at_first_invalid_record() {
        try (var q = new HybridQueue(cfg(8, SpillOrdering.STRICT_FIFO))) {
            assertThrows(IllegalArgumentException.class, () -> q.pushBatch(List.of("ok", "bad\n", "never")));
            assertEquals(List.of("ok"), drain(q));
        }
    }

    @Test
    void records_left_on_disk_by_an_earlier_run_come_out_first_under_strict_fifo() throws Exception {
        Files.writeString(file, "old1\nold2\n");
        try (var q = new HybridQueue(cfg(8, SpillOrdering.STRICT_FIFO))) {
            q.push("new");
            assertEquals(3, q.length());
            assertEquals(List.of("old1", "old2", "new"), drain(q));
        }
    }

    @Test
    void records_left_on_disk_come_out_after_memory_under_newest_first() throws Exception {
        Files.writeString(file, "old1\nold2\n");
        try (var q = new HybridQueue(cfg(8, SpillOrdering.SPILL_NEWEST_FIRST))) {
            q.push("new");
            assertEquals(List.of("new", "old1", "old2"), drain(q));
        }
    }
}
