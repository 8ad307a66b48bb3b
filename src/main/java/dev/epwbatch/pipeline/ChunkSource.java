package dev.epwbatch.pipeline;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;

/**
 * Sequential reader handing out bounded chunks of raw items.
 *
 * @param <R> raw item type
 */
public interface ChunkSource<R> extends Closeable {
    /**
     * Returns the next chunk of at most {@code maxSize} items, or an empty list once exhausted.
     */
    List<R> nextChunk(int maxSize) throws IOException;
}
