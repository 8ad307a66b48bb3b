package dev.epwbatch.client;

import dev.epwbatch.api.CacheStore;
import dev.epwbatch.cache.FileCacheStore;
import dev.epwbatch.config.BatchConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Hands out one {@link CacheStore} per named region, each in its own directory under
 * {@link BatchConfig#getCacheDir()}.
 *
 * <p>Two regions have their own budgets:
 * <ul>
 *   <li>{@value #BATCH_REGION}: whole-item outcomes ({@code cacheMaxSizeMB}, {@code cacheDefaultTtlSeconds})</li>
 *   <li>{@value #PROCESSED_REGION}: transformed tables ({@code processedCacheMaxSizeMB},
 *       {@code processedCacheTtlSeconds})</li>
 * </ul>
 * Any other region name uses the batch budget. When caching is disabled every region is
 * {@link CacheStore#disabled()}.
 *
 * <pre>{@code
 * try (CacheClient caches = new CacheClient(config)) {
 *     CacheStore batch = caches.getCache(CacheClient.BATCH_REGION);
 *     CacheStore processed = caches.getCache(CacheClient.PROCESSED_REGION);
 * }
 * }</pre>
 */
public class CacheClient implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(CacheClient.class);

    public static final String BATCH_REGION = "batch";
    public static final String PROCESSED_REGION = "processed";

    private static final long MB = 1024L * 1024L;

    private final BatchConfig config;
    private final Clock clock;
    private final Map<String, CacheStore> activeRegions = new ConcurrentHashMap<>();

    public CacheClient(BatchConfig config) {
        this(config, null);
    }

    /**
     * @param clock time source handed to every region, null for system UTC
     */
    public CacheClient(BatchConfig config, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.clock = clock;
    }

    /**
     * Returns the store for {@code region}, opening it on first use or after it was closed.
     *
     * @throws IllegalArgumentException     if region is empty or whitespace
     * @throws dev.epwbatch.error.CacheException if the region directory cannot be opened
     */
    public CacheStore getCache(String region) {
        Objects.requireNonNull(region, "region cannot be null");
        if (region.trim().isEmpty()) {
            throw new IllegalArgumentException("region cannot be empty or whitespace");
        }
        if (!config.isCacheEnabled()) {
            return CacheStore.disabled();
        }
        return activeRegions.compute(region, (r, existing) -> {
            if (existing != null && !isClosed(existing)) {
                return existing;
            }
            return open(r);
        });
    }

    private CacheStore open(String region) {
        MDC.put("cacheRegion", region);
        try {
            boolean processed = PROCESSED_REGION.equals(region);
            long maxMb = processed ? config.getProcessedCacheMaxSizeMB() : config.getCacheMaxSizeMB();
            long ttlSeconds = processed ? config.getProcessedCacheTtlSeconds() : config.getCacheDefaultTtlSeconds();
            Path dir = regionDir(config, region);
            logger.debug("Opening cache region '{}' at {}", region, dir);
            return new FileCacheStore(dir, maxMb * MB, Duration.ofSeconds(ttlSeconds), config.getIndexType(), clock);
        } finally {
            MDC.remove("cacheRegion");
        }
    }

    /** Directory of a region: the sanitized region name under the cache base directory. */
    public static Path regionDir(BatchConfig config, String region) {
        return Path.of(config.getCacheDir(), sanitize(region));
    }

    static String sanitize(String name) {
        return name.replaceAll("[^a-zA-Z0-9._-]", "_");
    }

    private static boolean isClosed(CacheStore store) {
        return store instanceof FileCacheStore && ((FileCacheStore) store).isClosed();
    }

    public Set<String> getOpenRegions() {
        return Set.copyOf(activeRegions.keySet());
    }

    @Override
    public void close() {
        activeRegions.forEach((region, store) -> {
            MDC.put("cacheRegion", region);
            try {
                store.close();
            } catch (RuntimeException e) {
                logger.warn("Failed to close cache region '{}': {}", region, e.getMessage(), e);
            } finally {
                MDC.remove("cacheRegion");
            }
        });
        activeRegions.clear();
    }
}
