package dev.epwbatch.error;

/**
 * Classification of failures surfaced by the pipeline and the cache.
 * Each kind carries a stable error code for programmatic handling.
 */
public enum ErrorKind {
    CONFIGURATION("CONFIG_ERROR"),
    STATION("STATION_ERROR"),
    DOWNLOAD("DOWNLOAD_ERROR"),
    VALIDATION("VALIDATION_ERROR"),
    PROCESSING("PROCESSING_ERROR"),
    GENERATION("EPW_ERROR"),
    CACHE("CACHE_ERROR"),
    RESOURCE("RESOURCE_ERROR"),
    UNEXPECTED("UNEXPECTED_ERROR");

    private final String code;

    ErrorKind(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
