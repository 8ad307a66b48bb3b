package dev.epwbatch.ser;

import dev.epwbatch.api.DataType;
import dev.epwbatch.pipeline.WeatherTable;

/**
 * Resolves the serializer for a (data type, value class) pair.
 */
public final class PayloadCodecs {
    private static final Utf8StringSerializer STRINGS = new Utf8StringSerializer();
    private static final ByteArraySerializer BYTES = new ByteArraySerializer();
    private static final WeatherTableCsvSerializer TABLES = new WeatherTableCsvSerializer();
    private static final JsonSerializer<Object> JSON = new JsonSerializer<>();

    private PayloadCodecs() {}

    /**
     * @throws IllegalArgumentException if {@code type} cannot be stored as {@code dataType}
     */
    @SuppressWarnings("unchecked")
    public static <T> Serializer<T> forType(DataType dataType, Class<T> type) {
        switch (dataType) {
            case BLOB:
                if (type == byte[].class) return (Serializer<T>) BYTES;
                if (type == String.class) return (Serializer<T>) STRINGS;
                throw new IllegalArgumentException("BLOB entries hold byte[] or String, not " + type.getName());
            case TABULAR:
                if (type == WeatherTable.class) return (Serializer<T>) TABLES;
                throw new IllegalArgumentException("TABULAR entries hold WeatherTable, not " + type.getName());
            case RECORD:
                return (Serializer<T>) JSON;
            default:
                throw new IllegalArgumentException("Unknown data type " + dataType);
        }
    }

    /**
     * Serializes {@code value} with the codec for its runtime class.
     */
    @SuppressWarnings("unchecked")
    public static byte[] encode(DataType dataType, Object value) {
        Class<Object> type = (Class<Object>) (value instanceof CharSequence ? String.class : value.getClass());
        Object v = value instanceof CharSequence ? value.toString() : value;
        return forType(dataType, type).serialize(v);
    }
}
