package dev.epwbatch.cache;

import dev.epwbatch.api.CacheStats;
import dev.epwbatch.api.CacheStore;
import dev.epwbatch.api.DataType;
import dev.epwbatch.config.IndexType;
import dev.epwbatch.error.CacheException;
import dev.epwbatch.ser.PayloadCodecs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Directory-backed {@link CacheStore}: one payload file per entry plus an index of
 * {@link CacheEntryMeta} records.
 *
 * <p>After each {@code set} an eviction pass runs in two steps:
 * <ol>
 *   <li>expiry sweep: entries older than their TTL, and index records whose payload file is
 *       missing, are removed.</li>
 *   <li>size sweep: while the on-disk total exceeds the budget, the least recently accessed
 *       entry is removed.</li>
 * </ol>
 *
 * <p>Once closed, reads miss and writes are logged and dropped; the files on disk are left as they were.
 *
 * <p><strong>Thread Safety:</strong> a read/write lock guards the index. Mutations, sweeps and the
 * last-access update of a hit hold the write lock; {@code has}, {@code stats} and the read phase of
 * {@code get} hold the read lock.
 *
 * <p><strong>Usage Example:</strong>
 * <pre>{@code
 * try (CacheStore cache = new FileCacheStore(Path.of("data/cache/batch"), 200L << 20,
 *                                            Duration.ofHours(24), IndexType.JSON_FILE, null)) {
 *     cache.set("batch_result_260_2023", outcome);
 *     Optional<CachedOutcome> hit = cache.get("batch_result_260_2023", CachedOutcome.class);
 * }
 * }</pre>
 */
public class FileCacheStore implements CacheStore {
    private static final Logger logger = LoggerFactory.getLogger(FileCacheStore.class);

    static final String INDEX_FILE = "cache_metadata.json";
    static final String ROCKS_INDEX_DIR = "index.rocks";

    private final Path dir;
    private final long maxBytes;
    private final Duration defaultTtl;
    private final Clock clock;
    private final CacheIndex index;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * Opens (or creates) a cache in {@code dir}.
     *
     * @param maxBytes   byte budget enforced by the size sweep
     * @param defaultTtl TTL applied when {@code set} is called without one
     * @param clock      time source, null for system UTC
     * @throws CacheException if the directory or the index cannot be opened
     */
    public FileCacheStore(Path dir, long maxBytes, Duration defaultTtl, IndexType indexType, Clock clock) {
        this.dir = Objects.requireNonNull(dir, "dir cannot be null");
        this.defaultTtl = Objects.requireNonNull(defaultTtl, "defaultTtl cannot be null");
        checkTtl(defaultTtl);
        Objects.requireNonNull(indexType, "indexType cannot be null");
        if (maxBytes <= 0) {
            throw new IllegalArgumentException("maxBytes must be positive, got " + maxBytes);
        }
        this.maxBytes = maxBytes;
        this.clock = (clock != null) ? clock : Clock.systemUTC();

        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new CacheException("Failed to create cache directory: " + dir, dir.toString(), "open", e);
        }
        this.index = indexType == IndexType.ROCKSDB
                ? new RocksCacheIndex(dir.resolve(ROCKS_INDEX_DIR).toString())
                : new JsonFileCacheIndex(dir.resolve(INDEX_FILE));

        logger.info("Opened cache at {} ({} index, {} entries, budget {} MB, default TTL {}s)",
                dir, indexType, index.size(), maxBytes / (1024 * 1024), defaultTtl.getSeconds());
    }

    public Path getDirectory() {
        return dir;
    }

    private long now() {
        return clock.millis();
    }

    // Index records keep whole seconds.
    private static long checkTtl(Duration ttl) {
        if (ttl.isNegative() || ttl.isZero() || ttl.getNano() != 0) {
            throw new IllegalArgumentException("ttl must be a positive whole number of seconds, got " + ttl);
        }
        return ttl.getSeconds();
    }

    private Path payloadPath(CacheEntryMeta meta) {
        return dir.resolve(CacheKeys.fileName(meta.key(), meta.dataType()));
    }

    @Override
    public boolean has(String key) {
        Objects.requireNonNull(key, "key cannot be null");
        lock.readLock().lock();
        try {
            if (closed.get()) {
                return false;
            }
            Optional<CacheEntryMeta> meta = index.get(key);
            return meta.isPresent() && readVerified(meta.get()).isPresent();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(type, "type cannot be null");

        CacheEntryMeta meta;
        T value;
        lock.readLock().lock();
        try {
            if (closed.get()) {
                logger.debug("Cache at {} is closed, '{}' is a miss", dir, key);
                return Optional.empty();
            }
            Optional<CacheEntryMeta> found = index.get(key);
            if (found.isEmpty()) {
                return Optional.empty();
            }
            meta = found.get();
            Optional<byte[]> bytes = readVerified(meta);
            if (bytes.isEmpty()) {
                return Optional.empty();
            }
            try {
                value = PayloadCodecs.forType(meta.dataType(), type).deserialize(bytes.get(), type);
            } catch (RuntimeException e) {
                logger.warn("Failed to decode cache entry '{}' as {}: {}", key, type.getSimpleName(), e.getMessage());
                return Optional.empty();
            }
        } finally {
            lock.readLock().unlock();
        }

        touch(meta);
        logger.debug("Cache hit for '{}'", key);
        return Optional.ofNullable(value);
    }

    // Records the access unless the entry was replaced since it was read.
    private void touch(CacheEntryMeta meta) {
        lock.writeLock().lock();
        try {
            if (closed.get()) {
                return;
            }
            Optional<CacheEntryMeta> current = index.get(meta.key());
            if (current.isPresent() && current.get().createdAtMillis() == meta.createdAtMillis()) {
                index.put(current.get().withLastAccess(now()));
            }
        } catch (IOException e) {
            logger.warn("Failed to update last access for '{}': {}", meta.key(), e.getMessage());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Payload bytes if the entry is unexpired, readable and matches its checksum.
     */
    private Optional<byte[]> readVerified(CacheEntryMeta meta) {
        if (meta.isExpired(now())) {
            logger.debug("Cache entry '{}' expired", meta.key());
            return Optional.empty();
        }
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(payloadPath(meta));
        } catch (NoSuchFileException e) {
            logger.debug("Payload for '{}' is missing", meta.key());
            return Optional.empty();
        } catch (IOException e) {
            logger.warn("Failed to read payload for '{}': {}", meta.key(), e.getMessage());
            return Optional.empty();
        }
        String actual = CacheKeys.crc32Hex(bytes);
        if (!actual.equals(meta.checksum())) {
            logger.warn("Checksum mismatch for cache entry '{}' (expected {}, got {})",
                    meta.key(), meta.checksum(), actual);
            return Optional.empty();
        }
        return Optional.of(bytes);
    }

    @Override
    public void set(String key, Object value) {
        set(key, value, defaultTtl, null);
    }

    @Override
    public void set(String key, Object value, Duration ttl) {
        set(key, value, ttl, null);
    }

    @Override
    public void set(String key, Object value, Duration ttl, DataType dataType) {
        Objects.requireNonNull(key, "key cannot be null");
        if (value == null) {
            logger.warn("Refusing to cache null value for '{}'", key);
            return;
        }
        long ttlSeconds = checkTtl(ttl != null ? ttl : defaultTtl);
        DataType type = dataType != null ? dataType : DataType.detect(value);

        byte[] bytes;
        try {
            bytes = PayloadCodecs.encode(type, value);
        } catch (RuntimeException e) {
            logger.warn("Failed to serialize '{}' as {}: {}", key, type, e.getMessage());
            return;
        }

        lock.writeLock().lock();
        try {
            if (closed.get()) {
                logger.warn("Cache at {} is closed, not caching '{}'", dir, key);
                return;
            }
            long ts = now();
            CacheEntryMeta meta = new CacheEntryMeta(key, type, ts, ts, ttlSeconds,
                    CacheKeys.crc32Hex(bytes), bytes.length);
            Optional<CacheEntryMeta> previous = index.get(key);
            Path target = payloadPath(meta);
            try {
                Files.write(target, bytes);
            } catch (IOException e) {
                logger.warn("Failed to write payload for '{}' to {}: {}", key, target, e.getMessage());
                return;
            }
            try {
                index.put(meta);
            } catch (IOException e) {
                logger.warn("Failed to update cache index for '{}': {}", key, e.getMessage());
                deleteQuietly(target);
                return;
            }
            // a replaced entry with another data type leaves its old payload file behind
            if (previous.isPresent() && previous.get().dataType() != type) {
                deleteQuietly(payloadPath(previous.get()));
            }
            logger.debug("Cached '{}' ({} bytes, {}, ttl {}s)", key, bytes.length, type, meta.ttlSeconds());
            evict();
        } finally {
            lock.writeLock().unlock();
        }
    }

    // Caller holds the write lock.
    private void evict() {
        expirySweep();
        sizeSweep();
    }

    private int expirySweep() {
        long ts = now();
        List<String> doomed = new ArrayList<>();
        for (CacheEntryMeta meta : index.all()) {
            Path payload = payloadPath(meta);
            if (meta.isExpired(ts)) {
                deleteQuietly(payload);
                doomed.add(meta.key());
            } else if (!Files.exists(payload)) {
                doomed.add(meta.key());
            }
        }
        if (doomed.isEmpty()) {
            return 0;
        }
        try {
            index.removeAll(doomed);
            logger.info("Removed {} expired or orphaned cache entries from {}", doomed.size(), dir);
        } catch (IOException e) {
            logger.warn("Failed to remove {} expired index records: {}", doomed.size(), e.getMessage());
        }
        return doomed.size();
    }

    private void sizeSweep() {
        List<CacheEntryMeta> entries = new ArrayList<>(index.all());
        long total = 0;
        for (CacheEntryMeta meta : entries) {
            total += onDiskSize(meta);
        }
        if (total <= maxBytes) {
            return;
        }

        entries.sort(Comparator.comparingLong(CacheEntryMeta::lastAccessMillis));
        List<String> evicted = new ArrayList<>();
        for (CacheEntryMeta meta : entries) {
            if (total <= maxBytes) break;
            total -= onDiskSize(meta);
            deleteQuietly(payloadPath(meta));
            evicted.add(meta.key());
        }
        try {
            index.removeAll(evicted);
        } catch (IOException e) {
            logger.warn("Failed to remove {} evicted index records: {}", evicted.size(), e.getMessage());
        }
        logger.info("Evicted {} cache entries from {} to stay within {} bytes", evicted.size(), dir, maxBytes);
    }

    private long onDiskSize(CacheEntryMeta meta) {
        try {
            return Files.size(payloadPath(meta));
        } catch (IOException e) {
            return meta.sizeBytes();
        }
    }

    private void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            logger.warn("Failed to delete cache file {}: {}", file, e.getMessage());
        }
    }

    @Override
    public boolean delete(String key) {
        Objects.requireNonNull(key, "key cannot be null");
        lock.writeLock().lock();
        try {
            if (closed.get()) {
                logger.warn("Cache at {} is closed, not deleting '{}'", dir, key);
                return false;
            }
            Optional<CacheEntryMeta> meta = index.get(key);
            if (meta.isEmpty()) {
                return false;
            }
            deleteQuietly(payloadPath(meta.get()));
            index.remove(key);
            return true;
        } catch (IOException e) {
            logger.warn("Failed to remove index record for '{}': {}", key, e.getMessage());
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void clear() {
        lock.writeLock().lock();
        try {
            if (closed.get()) {
                logger.warn("Cache at {} is closed, nothing cleared", dir);
                return;
            }
            int n = 0;
            for (CacheEntryMeta meta : index.all()) {
                deleteQuietly(payloadPath(meta));
                n++;
            }
            index.clear();
            logger.info("Cleared {} entries from cache {}", n, dir);
        } catch (IOException e) {
            logger.warn("Failed to clear cache index at {}: {}", dir, e.getMessage());
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public CacheStats stats() {
        lock.readLock().lock();
        try {
            if (closed.get()) {
                return CacheStats.empty(maxBytes);
            }
            long ts = now();
            int count = 0;
            int expired = 0;
            long total = 0;
            for (CacheEntryMeta meta : index.all()) {
                count++;
                total += meta.sizeBytes();
                if (meta.isExpired(ts)) expired++;
            }
            double usage = maxBytes > 0 ? total * 100.0 / maxBytes : 0.0;
            return new CacheStats(count, count - expired, expired, total, maxBytes, usage);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int purgeExpired() {
        lock.writeLock().lock();
        try {
            if (closed.get()) {
                logger.warn("Cache at {} is closed, nothing purged", dir);
                return 0;
            }
            return expirySweep();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            logger.debug("Close called on already closed cache at {}", dir);
            return;
        }
        lock.writeLock().lock();
        try {
            index.close();
            logger.info("Closed cache at {}", dir);
        } finally {
            lock.writeLock().unlock();
        }
    }
}
