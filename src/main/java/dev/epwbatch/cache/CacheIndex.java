package dev.epwbatch.cache;

import java.io.IOException;
import java.util.Collection;
import java.util.Optional;

/**
 * Metadata of all entries in a cache directory. Not thread-safe; {@link FileCacheStore} serializes
 * access with its index lock.
 */
interface CacheIndex extends AutoCloseable {
    Optional<CacheEntryMeta> get(String key);

    Collection<CacheEntryMeta> all();

    int size();

    void put(CacheEntryMeta meta) throws IOException;

    void remove(String key) throws IOException;

    /** Removes several records with one persisted mutation. */
    void removeAll(Collection<String> keys) throws IOException;

    void clear() throws IOException;

    @Override
    void close();
}
