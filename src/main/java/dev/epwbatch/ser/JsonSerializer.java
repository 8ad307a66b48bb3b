package dev.epwbatch.ser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import dev.epwbatch.error.CacheException;

import java.io.IOException;

/**
 * JSON codec for RECORD entries and index records. Records are read back through their canonical
 * constructors, so fields added later are ignored by older readers.
 */
public class JsonSerializer<T> implements Serializer<T> {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);

    @Override
    public byte[] serialize(T value) {
        try {
            return MAPPER.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new CacheException("Failed to encode " + value.getClass().getSimpleName() + " as JSON",
                    null, "serialize", e);
        }
    }

    @Override
    public T deserialize(byte[] bytes, Class<T> type) {
        try {
            return MAPPER.readValue(bytes, type);
        } catch (IOException e) {
            throw new CacheException("Failed to decode JSON payload as " + type.getSimpleName(),
                    null, "deserialize", e);
        }
    }
}
