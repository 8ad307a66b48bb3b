package dev.epwbatch.error;

/**
 * Only thrown while opening a cache. Reads and writes on an open cache degrade to misses instead.
 */
public class CacheException extends EpwBatchException {
    public CacheException(String message, String cacheDir, String operation, Throwable cause) {
        super(ErrorKind.CACHE, message, context("cache_dir", cacheDir, "operation", operation), cause);
    }
}
