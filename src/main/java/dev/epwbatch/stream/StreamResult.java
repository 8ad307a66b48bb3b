package dev.epwbatch.stream;

import java.util.List;

/**
 * Outcome of a chunked run.
 *
 * @param records         successful chunks' output, concatenated and sorted
 * @param chunksProcessed chunks whose function returned normally
 * @param chunksFailed    chunks skipped after an error
 * @param peakMb          highest heap usage seen during the run
 */
public record StreamResult<O>(List<O> records, int chunksProcessed, int chunksFailed, double peakMb) {
    public StreamResult {
        records = List.copyOf(records);
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }
}
