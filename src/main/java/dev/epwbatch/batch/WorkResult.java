package dev.epwbatch.batch;

import dev.epwbatch.error.ErrorKind;

import java.time.Duration;

/**
 * Outcome of one work item. Successful results carry the output path; failed ones carry the
 * error kind and message.
 */
public record WorkResult(
        StationYear key,
        boolean success,
        String outputPath,
        ErrorKind errorKind,
        String errorMessage,
        Duration duration,
        long recordCount,
        boolean cacheHit
) {
    public static WorkResult success(StationYear key, String outputPath, long recordCount, Duration duration,
                                     boolean cacheHit) {
        return new WorkResult(key, true, outputPath, null, null, duration, recordCount, cacheHit);
    }

    public static WorkResult failure(StationYear key, ErrorKind kind, String message, Duration duration) {
        return new WorkResult(key, false, null, kind, message, duration, 0L, false);
    }

    public double durationSeconds() {
        return duration.toNanos() / 1e9;
    }
}
