package dev.epwbatch.pipeline;

import dev.epwbatch.station.StationMeta;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Writes the final artifact and returns the path actually written.
 */
@FunctionalInterface
public interface ArtifactWriter {
    Path write(WeatherTable table, StationMeta station, int year, Path outputPath) throws IOException;
}
