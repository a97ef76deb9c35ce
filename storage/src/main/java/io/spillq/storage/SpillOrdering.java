package io.spillq.storage;

/**
 * How a queue orders records across a spill boundary.
 */
public enum SpillOrdering {

    /**
     * The record that triggers a spill joins the spilled batch on disk, and
     * pops drain disk before memory while disk holds records.
     * Everything on disk is older than everything in memory, so output is FIFO.
     */
    STRICT_FIFO,

    /**
     * The record that triggers a spill goes into the freshly emptied ring and
     * pops always prefer memory. That record (and anything pushed after it)
     * comes out before the older spilled records. Matches the line-file
     * queues this format was written for.
     */
    SPILL_NEWEST_FIRST
}
