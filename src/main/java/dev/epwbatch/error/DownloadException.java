package dev.epwbatch.error;

/**
 * Raised by fetch collaborators. {@code httpStatus} is optional; values below 1 are omitted.
 */
public class DownloadException extends EpwBatchException {
    public DownloadException(String message, String url, String stationId, Integer year, Integer httpStatus) {
        this(message, url, stationId, year, httpStatus, null);
    }

    public DownloadException(String message, String url, String stationId, Integer year, Integer httpStatus,
                             Throwable cause) {
        super(ErrorKind.DOWNLOAD, message,
                context("url", url, "station_id", stationId, "year", year,
                        "http_status", httpStatus != null && httpStatus > 0 ? httpStatus : null),
                cause);
    }
}
