package dev.epwbatch.error;

public class StationException extends EpwBatchException {
    public StationException(String message, String stationId, String operation) {
        super(ErrorKind.STATION, message, context("station_id", stationId, "operation", operation), null);
    }

    public StationException(String message, String stationId, String operation, Throwable cause) {
        super(ErrorKind.STATION, message, context("station_id", stationId, "operation", operation), cause);
    }
}
