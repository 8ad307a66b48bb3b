package dev.epwbatch.pipeline;

import dev.epwbatch.station.StationRegistry;

import java.util.Objects;

/**
 * The external functions a batch run borrows: station lookup, fetch, transform, validate and write.
 */
public record PipelineCollaborators(
        StationRegistry stations,
        RawDataFetcher fetcher,
        WeatherTransformer transformer,
        TableValidator validator,
        ArtifactWriter writer
) {
    public PipelineCollaborators {
        Objects.requireNonNull(stations, "stations cannot be null");
        Objects.requireNonNull(fetcher, "fetcher cannot be null");
        Objects.requireNonNull(transformer, "transformer cannot be null");
        Objects.requireNonNull(validator, "validator cannot be null");
        Objects.requireNonNull(writer, "writer cannot be null");
    }
}
