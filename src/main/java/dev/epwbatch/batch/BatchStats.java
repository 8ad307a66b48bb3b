package dev.epwbatch.batch;

import java.time.Duration;
import java.util.List;

public record BatchStats(
        int total,
        int successful,
        int failed,
        Duration totalTime,
        Duration averageTimePerStation,
        long totalDataRecords,
        long cacheHits,
        long cacheMisses
) {
    static BatchStats of(List<WorkResult> results, Duration totalTime, long cacheHits, long cacheMisses) {
        int ok = 0;
        long records = 0;
        for (WorkResult r : results) {
            if (r.success()) {
                ok++;
                records += r.recordCount();
            }
        }
        int total = results.size();
        Duration avg = total == 0 ? Duration.ZERO : totalTime.dividedBy(total);
        return new BatchStats(total, ok, total - ok, totalTime, avg, records, cacheHits, cacheMisses);
    }

    public double successRate() {
        return total == 0 ? 0.0 : successful * 100.0 / total;
    }
}
