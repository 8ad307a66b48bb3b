package dev.epwbatch.station;

import java.util.Objects;

/**
 * Weather station description used to place and label output artifacts.
 */
public record StationMeta(String stationId, String name, String abbreviation, double latitude, double longitude) {
    public StationMeta {
        Objects.requireNonNull(stationId, "stationId cannot be null");
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(abbreviation, "abbreviation cannot be null");
    }

    @Override
    public String toString() {
        return "Station " + stationId + ": " + name + " (" + abbreviation + ")";
    }
}
