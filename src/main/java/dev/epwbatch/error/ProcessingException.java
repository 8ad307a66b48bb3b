package dev.epwbatch.error;

public class ProcessingException extends EpwBatchException {
    public ProcessingException(String message, Throwable cause) {
        super(ErrorKind.PROCESSING, message, cause);
    }

    public ProcessingException(String message, String stationId, Integer year, String stage, Throwable cause) {
        super(ErrorKind.PROCESSING, message,
                context("station_id", stationId, "year", year, "processing_stage", stage), cause);
    }
}
