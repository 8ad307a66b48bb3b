package dev.epwbatch.ser;

import java.util.Arrays;

public class ByteArraySerializer implements Serializer<byte[]> {
    @Override
    public byte[] serialize(byte[] value) {
        return Arrays.copyOf(value, value.length);
    }

    @Override
    public byte[] deserialize(byte[] bytes, Class<byte[]> type) {
        return bytes;
    }
}
