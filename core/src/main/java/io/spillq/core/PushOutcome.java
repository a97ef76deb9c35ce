package io.spillq.core;

/**
 * Result of offering an element to a MemoryRing.
 * <p>
 * Full is a recoverable condition: the queue facade reacts by spilling the
 * ring to its backing store and trying again.
 */
public sealed interface PushOutcome permits PushOutcome.Accepted, PushOutcome.Full {

    /** Element stored; occupancy is the ring size after the insert. */
    record Accepted(int occupancy) implements PushOutcome {}

    /** No free slot; nothing was stored. */
    record Full(int occupancy, int capacity) implements PushOutcome {}
}
