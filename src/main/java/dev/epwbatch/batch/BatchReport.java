package dev.epwbatch.batch;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Results of one {@link BatchProcessor#processBatch} call, in the order they were produced.
 */
public record BatchReport(List<WorkResult> results, BatchStats stats) {
    public BatchReport {
        results = List.copyOf(results);
    }

    /** Failed keys and their messages. A key submitted twice keeps its last message. */
    public Map<StationYear, String> failures() {
        Map<StationYear, String> out = new LinkedHashMap<>();
        for (WorkResult r : results) {
            if (!r.success()) out.put(r.key(), r.errorMessage());
        }
        return out;
    }

    public boolean anySucceeded() {
        return stats.successful() > 0;
    }
}
