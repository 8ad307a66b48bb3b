package dev.epwbatch.api;

import java.time.Duration;
import java.util.Optional;

/**
 * Persistent key/value cache with per-entry TTL, a byte budget enforced by least-recently-accessed
 * eviction, and checksum verification on read.
 *
 * <p>Reads never throw for missing, expired or corrupt entries; they report a miss. Writes are
 * best-effort: a failed {@code set} is logged and leaves the key uncached. An expired or corrupt
 * entry stays on disk until the next eviction pass, which runs after every {@code set}.
 */
public interface CacheStore extends AutoCloseable {

    /** True iff an unexpired entry with a matching checksum exists for {@code key}. */
    boolean has(String key);

    /**
     * Returns the cached value, updating its last access time on a hit.
     *
     * @param type value class; must be readable under the entry's {@link DataType}
     */
    <T> Optional<T> get(String key, Class<T> type);

    /** Stores {@code value} with the default TTL, choosing the encoding from its class. */
    void set(String key, Object value);

    /**
     * @param ttl lifetime in whole seconds; null for the default
     * @throws IllegalArgumentException if {@code ttl} is not positive or has a sub-second part
     */
    void set(String key, Object value, Duration ttl);

    void set(String key, Object value, Duration ttl, DataType dataType);

    /** @return true if an entry was removed */
    boolean delete(String key);

    void clear();

    CacheStats stats();

    /**
     * Runs only the expiry sweep.
     *
     * @return number of entries removed
     */
    int purgeExpired();

    @Override
    void close();

    /**
     * A store that never holds anything. Used when caching is switched off.
     */
    static CacheStore disabled() {
        return DisabledCacheStore.INSTANCE;
    }
}
