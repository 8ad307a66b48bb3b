package dev.epwbatch.api;

import dev.epwbatch.pipeline.WeatherTable;

/**
 * Payload encoding of a cache entry. The file extension of the payload file follows the type.
 */
public enum DataType {
    /** Opaque bytes or UTF-8 text. */
    BLOB(".bin"),
    /** A {@link WeatherTable} stored as CSV. */
    TABULAR(".csv"),
    /** Any other value, stored as JSON. */
    RECORD(".json");

    private final String extension;

    DataType(String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }

    /**
     * Picks the encoding for a value when the caller does not name one.
     */
    public static DataType detect(Object value) {
        if (value instanceof WeatherTable) return TABULAR;
        if (value instanceof byte[] || value instanceof CharSequence) return BLOB;
        return RECORD;
    }
}
