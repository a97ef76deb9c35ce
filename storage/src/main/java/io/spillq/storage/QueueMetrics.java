package io.spillq.storage;

import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory counters for one queue.
 *
 * JVM-local and thread-safe via AtomicLong; nothing is exported.
 *
 * Tracked:
 *  - pushes:          records accepted by push()
 *  - memoryPops:      pops served from the ring
 *  - diskPops:        pops served by compacting the backing file
 *  - emptyPops:       pops that found nothing
 *  - spills:          successful ring -> file spills
 *  - recordsSpilled:  records written by those spills
 *  - spillFailures:   spills that threw
 *  - truncatedPops:   pops whose record was cut to the length limit
 */
public final class QueueMetrics {

    private final AtomicLong pushes         = new AtomicLong();
    private final AtomicLong memoryPops     = new AtomicLong();
    private final AtomicLong diskPops       = new AtomicLong();
    private final AtomicLong emptyPops      = new AtomicLong();
    private final AtomicLong spills         = new AtomicLong();
    private final AtomicLong recordsSpilled = new AtomicLong();
    private final AtomicLong spillFailures  = new AtomicLong();
    private final AtomicLong truncatedPops  = new AtomicLong();

    void recordPush()                 { pushes.incrementAndGet(); }
    void recordMemoryPop()            { memoryPops.incrementAndGet(); }
    void recordDiskPop()              { diskPops.incrementAndGet(); }
    void recordEmptyPop()             { emptyPops.incrementAndGet(); }
    void recordSpillFailure()         { spillFailures.incrementAndGet(); }
    void recordTruncatedPop()         { truncatedPops.incrementAndGet(); }

    void recordSpill(int records) {
        spills.incrementAndGet();
        recordsSpilled.addAndGet(records);
    }

    public long pushes()         { return pushes.get(); }
    public long memoryPops()     { return memoryPops.get(); }
    public long diskPops()       { return diskPops.get(); }
    public long emptyPops()      { return emptyPops.get(); }
    public long spills()         { return spills.get(); }
    public long recordsSpilled() { return recordsSpilled.get(); }
    public long spillFailures()  { return spillFailures.get(); }
    public long truncatedPops()  { return truncatedPops.get(); }

    @Override
    public String toString() {
        return "QueueMetrics{" +
                "pushes=" + pushes.get() +
                ", memoryPops=" + memoryPops.get() +
                ", diskPops=" + diskPops.get() +
                ", emptyPops=" + emptyPops.get() +
                ", spills=" + spills.get() +
                ", recordsSpilled=" + recordsSpilled.get() +
                ", spillFailures=" + spillFailures.get() +
                ", truncatedPops=" + truncatedPops.get() +
                '}';
    }
}
