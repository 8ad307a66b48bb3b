package dev.epwbatch.error;

public class GenerationException extends EpwBatchException {
    public GenerationException(String message, String outputPath, String stationId, Integer year, Throwable cause) {
        super(ErrorKind.GENERATION, message,
                context("output_path", outputPath, "station_id", stationId, "year", year), cause);
    }
}
