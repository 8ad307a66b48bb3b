package dev.epwbatch.ser;

import java.nio.charset.StandardCharsets;

/**
 * BLOB codec for text payloads such as rendered EPW content.
 */
public class Utf8StringSerializer implements Serializer<String> {
    @Override
    public byte[] serialize(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public String deserialize(byte[] bytes, Class<String> type) {
        return new String(bytes, StandardCharsets.UTF_8);
    }
}
