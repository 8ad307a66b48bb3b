package dev.epwbatch.batch;

/**
 * What the batch cache keeps for a successful item.
 */
public record CachedOutcome(String stationId, int year, boolean success, String outputPath, long recordCount,
                            double durationSeconds) {

    static CachedOutcome of(WorkResult result) {
        return new CachedOutcome(result.key().stationId(), result.key().year(), result.success(),
                result.outputPath(), result.recordCount(), result.durationSeconds());
    }
}
