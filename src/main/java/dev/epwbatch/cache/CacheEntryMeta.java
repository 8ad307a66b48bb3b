package dev.epwbatch.cache;

import dev.epwbatch.api.DataType;

/**
 * Index record for one cache entry. The payload itself lives in a separate file.
 *
 * @param checksum CRC32 of the serialized payload, lower-case hex
 */
public record CacheEntryMeta(
        String key,
        DataType dataType,
        long createdAtMillis,
        long lastAccessMillis,
        long ttlSeconds,
        String checksum,
        long sizeBytes
) {
    public boolean isExpired(long nowMillis) {
        return nowMillis - createdAtMillis > ttlSeconds * 1000L;
    }

    public CacheEntryMeta withLastAccess(long millis) {
        return new CacheEntryMeta(key, dataType, createdAtMillis, millis, ttlSeconds, checksum, sizeBytes);
    }
}
