package dev.epwbatch.batch;

import lombok.Getter;
import lombok.Setter;
import lombok.experimental.Accessors;

/**
 * Per-call switches for {@link BatchProcessor#processBatch}.
 */
@Getter
@Setter
@Accessors(chain = true)
public class BatchOptions {
    private boolean parallel = true;
    private Integer maxWorkers;                // null = config value
    private boolean forceRefresh = false;      // skip cache reads, still write on success
    private boolean streaming = false;
    private ProgressListener progressListener = ProgressListener.NONE;

    public static BatchOptions sequential() {
        return new BatchOptions().setParallel(false);
    }

    public static BatchOptions parallel(int workers) {
        return new BatchOptions().setParallel(true).setMaxWorkers(workers);
    }
}
