package dev.epwbatch.station;

import java.util.Collection;
import java.util.Optional;

/**
 * Read-only lookup of weather stations by id.
 */
public interface StationRegistry {
    Optional<StationMeta> find(String stationId);

    Collection<StationMeta> all();

    default boolean contains(String stationId) {
        return find(stationId).isPresent();
    }
}
