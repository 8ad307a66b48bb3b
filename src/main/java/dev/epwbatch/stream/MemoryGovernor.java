package dev.epwbatch.stream;

import dev.epwbatch.error.ResourceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Tracks heap usage of the JVM and asks for garbage collection between streaming chunks.
 *
 * <p>Usage readings go through {@link #sampleUsedBytes()} so tests can script them.
 */
public class MemoryGovernor {
    private static final Logger logger = LoggerFactory.getLogger(MemoryGovernor.class);
    private static final long MB = 1024L * 1024L;

    private final long limitMb;
    private final AtomicLong peakBytes = new AtomicLong();
    private final AtomicLong reclaims = new AtomicLong();

    /**
     * @param limitMb heap ceiling checked by {@link #ensureWithinLimit()}, 0 for none
     */
    public MemoryGovernor(long limitMb) {
        if (limitMb < 0) {
            throw new IllegalArgumentException("limitMb must be >= 0, got " + limitMb);
        }
        this.limitMb = limitMb;
    }

    public MemoryGovernor() {
        this(0);
    }

    protected long sampleUsedBytes() {
        Runtime runtime = Runtime.getRuntime();
        return runtime.totalMemory() - runtime.freeMemory();
    }

    protected void requestGc() {
        System.gc();
    }

    private long observe() {
        long used = sampleUsedBytes();
        peakBytes.accumulateAndGet(used, Math::max);
        return used;
    }

    public double currentUsageMb() {
        return observe() / (double) MB;
    }

    public double peakUsageMb() {
        observe();
        return peakBytes.get() / (double) MB;
    }

    public long reclaimCount() {
        return reclaims.get();
    }

    /**
     * Requests a collection and returns the number of megabytes freed.
     */
    public long reclaim() {
        long before = observe();
        requestGc();
        long after = sampleUsedBytes();
        reclaims.incrementAndGet();
        long freedMb = (before - after) / MB;
        logger.debug("Memory cleanup: freed {}MB ({}MB -> {}MB used, peak {}MB)",
                freedMb, before / MB, after / MB, peakBytes.get() / MB);
        return freedMb;
    }

    /**
     * Reclaims once if usage is above the limit and fails if it still is.
     *
     * @throws ResourceException if usage stays above the configured limit
     */
    public void ensureWithinLimit() {
        if (limitMb == 0) {
            return;
        }
        long usedMb = observe() / MB;
        if (usedMb <= limitMb) {
            return;
        }
        reclaim();
        usedMb = sampleUsedBytes() / MB;
        if (usedMb > limitMb) {
            throw new ResourceException("Heap usage " + usedMb + "MB exceeds limit of " + limitMb + "MB",
                    "memory", usedMb + "MB", limitMb + "MB");
        }
    }
}
