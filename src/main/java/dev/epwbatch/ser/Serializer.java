package dev.epwbatch.ser;

/**
 * Byte codec for one cache payload class.
 *
 * <p>Implementations are stateless and shared between threads. Decoding failures surface as
 * unchecked exceptions, which the cache treats as a miss.
 */
public interface Serializer<T> {
    byte[] serialize(T value);

    T deserialize(byte[] bytes, Class<T> type);
}
