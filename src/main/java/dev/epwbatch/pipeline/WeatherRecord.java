package dev.epwbatch.pipeline;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One hourly observation after transformation. Values are keyed by column name; absent columns
 * mean missing data, so null values are dropped on construction.
 */
public record WeatherRecord(LocalDateTime timestamp, Map<String, Double> values) {
    public static final Comparator<WeatherRecord> BY_TIMESTAMP = Comparator.comparing(WeatherRecord::timestamp);

    public WeatherRecord {
        Objects.requireNonNull(timestamp, "timestamp cannot be null");
        Map<String, Double> present = new LinkedHashMap<>();
        if (values != null) {
            values.forEach((column, value) -> {
                if (value != null) present.put(column, value);
            });
        }
        values = Collections.unmodifiableMap(present);
    }
}
