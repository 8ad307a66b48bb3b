package dev.epwbatch.station;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

public class InMemoryStationRegistry implements StationRegistry {
    private final Map<String, StationMeta> stations;

    public InMemoryStationRegistry(Collection<StationMeta> stations) {
        Map<String, StationMeta> byId = new LinkedHashMap<>();
        for (StationMeta s : stations) {
            byId.put(s.stationId(), s);
        }
        this.stations = Collections.unmodifiableMap(byId);
    }

    @Override
    public Optional<StationMeta> find(String stationId) {
        return stationId == null ? Optional.empty() : Optional.ofNullable(stations.get(stationId.trim()));
    }

    @Override
    public Collection<StationMeta> all() {
        return stations.values();
    }

    @Override
    public String toString() {
        return "InMemoryStationRegistry[" + stations.size() + " stations]";
    }
}
