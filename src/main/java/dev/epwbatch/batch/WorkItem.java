package dev.epwbatch.batch;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * A (station, year) pair submitted to {@link BatchProcessor}. Duplicates in one batch are processed
 * independently.
 */
public record WorkItem(StationYear key) {
    public WorkItem {
        Objects.requireNonNull(key, "key cannot be null");
    }

    public static WorkItem of(String stationId, int year) {
        return new WorkItem(new StationYear(stationId, year));
    }

    /** One item per station for the same year, in iteration order. */
    public static List<WorkItem> forYear(Collection<String> stationIds, int year) {
        List<WorkItem> items = new ArrayList<>(stationIds.size());
        for (String id : stationIds) {
            items.add(of(id, year));
        }
        return items;
    }
}
