package dev.epwbatch.batch;

import java.util.concurrent.atomic.AtomicLong;

/** Cache hit/miss counters for one batch run, shared by its workers. */
final class RunCounters {
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    void hit() {
        hits.incrementAndGet();
    }

    void miss() {
        misses.incrementAndGet();
    }

    long hits() {
        return hits.get();
    }

    long misses() {
        return misses.get();
    }
}
