package dev.epwbatch.pipeline;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Timestamp-ordered table of transformed records. Records are sorted on construction, and every
 * value key of a record is a column: keys missing from {@code columns} are appended in first-seen
 * order.
 */
public record WeatherTable(List<String> columns, List<WeatherRecord> records) {
    public WeatherTable {
        Objects.requireNonNull(columns, "columns cannot be null");
        Objects.requireNonNull(records, "records cannot be null");
        Set<String> allColumns = new LinkedHashSet<>(columns);
        for (WeatherRecord r : records) {
            allColumns.addAll(r.values().keySet());
        }
        columns = List.copyOf(allColumns);
        List<WeatherRecord> sorted = new ArrayList<>(records);
        sorted.sort(WeatherRecord.BY_TIMESTAMP);
        records = List.copyOf(sorted);
    }

    /**
     * Builds a table whose columns are the value keys of {@code records} in first-seen order.
     */
    public static WeatherTable of(List<WeatherRecord> records) {
        return new WeatherTable(List.of(), records);
    }

    public static WeatherTable empty() {
        return new WeatherTable(List.of(), List.of());
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }
}
