package dev.epwbatch.pipeline;

import dev.epwbatch.station.StationMeta;

import java.io.IOException;
import java.util.List;

/**
 * Turns raw station lines into transformed weather records.
 *
 * <p>{@link #transform} reads the whole raw file at once. {@link #transformChunk} must be a pure
 * function of its input lines so chunks can be processed independently.
 */
public interface WeatherTransformer {
    WeatherTable transform(RawHandle raw, StationMeta station, int year) throws IOException;

    List<WeatherRecord> transformChunk(List<String> rawLines, StationMeta station, int year);
}
