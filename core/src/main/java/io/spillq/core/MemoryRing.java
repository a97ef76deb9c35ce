// file: core/src/main/java/io/spillq/core/MemoryRing.java
package io.spillq.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Fixed-capacity circular buffer of records with head/tail cursors.
 * <p>
 * Layout:
 *  - head: next slot to poll.
 *  - tail: next slot to fill.
 *  - One slot is always kept empty so that "full" and "empty" differ:
 *      * empty iff head == tail
 *      * full  iff (tail + 1) % capacity == head
 *    A ring of capacity c therefore holds at most c - 1 elements.
 * <p>
 * Ownership:
 *  - poll() clears the slot it returns, so the ring never keeps a reference
 *    to an element it has handed out.
 *  - clear() nulls every slot and resets both cursors to 0.
 * <p>
 * Not thread-safe. Callers serialize access (HybridQueue holds one lock
 * around every ring operation).
 */
public final class MemoryRing {
    private final String[] slots;
    private final int capacity;
    private int head = 0;
    private int tail = 0;

    public MemoryRing(int capacity) {
        if (capacity < 2) throw new IllegalArgumentException("capacity must be >= 2, got: " + capacity);
        this.capacity = capacity;
        this.slots = new String[capacity];
    }

    /**
     * Insert at tail.
     *
     * @return Accepted with the new occupancy, or Full if there is no free slot
     *         (state unchanged in that case).
     */
    public PushOutcome offer(String element) {
        Objects.requireNonNull(element, "element");
        if (isFull()) {
            return new PushOutcome.Full(size(), capacity);
        }
        slots[tail] = element;
        tail = (tail + 1) % capacity;
        return new PushOutcome.Accepted(size());
    }

    /** Remove from head, or return null if the ring is empty. */
    public String poll() {
        if (isEmpty()) return null;
        String value = slots[head];
        slots[head] = null;
        head = (head + 1) % capacity;
        return value;
    }

    public int size() {
        return (tail - head + capacity) % capacity;
    }

    public int capacity() {
        return capacity;
    }

    /** Maximum number of elements the ring can hold at once (capacity - 1). */
    public int usableCapacity() {
        return capacity - 1;
    }

    public boolean isEmpty() {
        return head == tail;
    }

    public boolean isFull() {
        return (tail + 1) % capacity == head;
    }

    /**
     * Copy of the current contents in head -> tail order. The ring is not modified.
     * Used by the spill path, which must write everything before it may clear.
     */
    public List<String> snapshot() {
        List<String> out = new ArrayList<>(size());
        for (int i = head; i != tail; i = (i + 1) % capacity) {
            out.add(slots[i]);
        }
        return out;
    }

    /** Drop every element and reset head = tail = 0. */
    public void clear() {
        for (int i = head; i != tail; i = (i + 1) % capacity) {
            slots[i] = null;
        }
        head = 0;
        tail = 0;
    }

    // package-private views for tests
    int head() { return head; }
    int tail() { return tail; }
}
