package dev.epwbatch.pipeline;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Location of a downloaded raw station file.
 *
 * @param headerLines number of leading lines that are not observations
 */
public record RawHandle(String stationId, int year, Path file, int headerLines) {
    public RawHandle {
        Objects.requireNonNull(stationId, "stationId cannot be null");
        Objects.requireNonNull(file, "file cannot be null");
        if (headerLines < 0) {
            throw new IllegalArgumentException("headerLines must be >= 0");
        }
    }

    public ChunkSource<String> openChunks() throws IOException {
        return new LineChunkSource(file, headerLines, StandardCharsets.UTF_8);
    }
}
