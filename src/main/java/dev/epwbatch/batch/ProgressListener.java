package dev.epwbatch.batch;

@FunctionalInterface
public interface ProgressListener {
    ProgressListener NONE = (completed, total, result) -> { };

    void onProgress(int completed, int total, WorkResult result);
}
