package dev.epwbatch.pipeline;

import java.io.IOException;

/**
 * Downloads (or locates an already downloaded) raw data file for a station and year.
 * Implementations signal failure with {@link dev.epwbatch.error.DownloadException} or an {@link IOException}.
 */
@FunctionalInterface
public interface RawDataFetcher {
    RawHandle fetch(String stationId, int year, boolean forceRefresh) throws IOException;
}
