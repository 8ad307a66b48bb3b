package dev.epwbatch.stream;

import dev.epwbatch.error.ProcessingException;
import dev.epwbatch.pipeline.ChunkSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Applies a per-chunk function over a {@link ChunkSource} so only one raw chunk is held at a time.
 * A chunk whose function throws is skipped; the others are kept, concatenated and sorted.
 */
public class StreamingTransform {
    private static final Logger logger = LoggerFactory.getLogger(StreamingTransform.class);

    private final MemoryGovernor governor;
    private final int reclaimEveryChunks;

    /**
     * @param reclaimEveryChunks call {@link MemoryGovernor#reclaim()} after this many processed chunks
     */
    public StreamingTransform(MemoryGovernor governor, int reclaimEveryChunks) {
        this.governor = Objects.requireNonNull(governor, "governor cannot be null");
        if (reclaimEveryChunks < 1) {
            throw new IllegalArgumentException("reclaimEveryChunks must be >= 1, got " + reclaimEveryChunks);
        }
        this.reclaimEveryChunks = reclaimEveryChunks;
    }

    public MemoryGovernor getGovernor() {
        return governor;
    }

    /**
     * Reads and transforms every chunk of {@code source}, then closes it.
     *
     * @throws ProcessingException if reading the source fails
     */
    public <R, O> StreamResult<O> transform(ChunkSource<R> source, int chunkSize,
                                            Function<List<R>, List<O>> perChunk, Comparator<? super O> ordering) {
        Objects.requireNonNull(source, "source cannot be null");
        Objects.requireNonNull(perChunk, "perChunk cannot be null");
        if (chunkSize < 1) {
            throw new IllegalArgumentException("chunkSize must be >= 1, got " + chunkSize);
        }

        List<O> out = new ArrayList<>();
        int index = 0;
        int processed = 0;
        int failed = 0;
        try (source) {
            List<R> chunk;
            while (!(chunk = source.nextChunk(chunkSize)).isEmpty()) {
                index++;
                try {
                    out.addAll(perChunk.apply(chunk));
                    processed++;
                } catch (RuntimeException e) {
                    failed++;
                    logger.warn("Error processing chunk {} ({} rows), skipping: {}", index, chunk.size(), e.getMessage());
                    continue;
                }
                if (processed % reclaimEveryChunks == 0) {
                    governor.reclaim();
                    logger.debug("Processed {} chunks, peak memory {}MB", processed,
                            String.format("%.1f", governor.peakUsageMb()));
                }
                governor.ensureWithinLimit();
            }
        } catch (IOException e) {
            throw new ProcessingException("Failed to read chunk " + (index + 1) + ": " + e.getMessage(), e);
        }

        if (ordering != null) {
            out.sort(ordering);
        }
        if (failed > 0) {
            logger.warn("Streaming finished with {} of {} chunks skipped", failed, index);
        }
        return new StreamResult<>(out, processed, failed, governor.peakUsageMb());
    }
}
