package dev.epwbatch.pipeline;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a text file as chunks of lines after skipping a fixed number of header lines.
 * Blank lines are dropped.
 */
public class LineChunkSource implements ChunkSource<String> {
    private final BufferedReader reader;
    private boolean exhausted;

    public LineChunkSource(Path file, int headerLines, Charset charset) throws IOException {
        this.reader = Files.newBufferedReader(file, charset);
        try {
            for (int i = 0; i < headerLines; i++) {
                if (reader.readLine() == null) {
                    exhausted = true;
                    break;
                }
            }
        } catch (IOException e) {
            reader.close();
            throw e;
        }
    }

    @Override
    public List<String> nextChunk(int maxSize) throws IOException {
        if (maxSize < 1) {
            throw new IllegalArgumentException("maxSize must be positive, got " + maxSize);
        }
        List<String> chunk = new ArrayList<>(Math.min(maxSize, 4096));
        while (!exhausted && chunk.size() < maxSize) {
            String line = reader.readLine();
            if (line == null) {
                exhausted = true;
                break;
            }
            if (!line.isBlank()) chunk.add(line);
        }
        return chunk;
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }
}
