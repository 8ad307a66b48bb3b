package dev.epwbatch.batch;

import java.util.Objects;

/** Identity of one unit of work. */
public record StationYear(String stationId, int year) {
    public StationYear {
        Objects.requireNonNull(stationId, "stationId cannot be null");
    }

    @Override
    public String toString() {
        return stationId + "/" + year;
    }
}
