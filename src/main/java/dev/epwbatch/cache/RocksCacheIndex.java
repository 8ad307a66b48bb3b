package dev.epwbatch.cache;

import dev.epwbatch.error.CacheException;
import dev.epwbatch.ser.JsonSerializer;
import org.rocksdb.Options;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.rocksdb.WriteBatch;
import org.rocksdb.WriteOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * One RocksDB record per cache key, so a mutation touches only that key. Values are the JSON form
 * of {@link CacheEntryMeta}.
 */
final class RocksCacheIndex implements CacheIndex {
    private static final Logger logger = LoggerFactory.getLogger(RocksCacheIndex.class);

    static { RocksDB.loadLibrary(); }

    private final String path;
    private final RocksDB db;
    private final WriteOptions writeOpts;
    private final JsonSerializer<CacheEntryMeta> serializer = new JsonSerializer<>();

    RocksCacheIndex(String path) {
        this.path = path;
        File dbDir = new File(path);
        if (!dbDir.exists() && !dbDir.mkdirs()) {
            throw new CacheException("Failed to create index directory: " + path, path, "open_index", null);
        }
        try (Options options = new Options().setCreateIfMissing(true)) {
            this.db = RocksDB.open(options, path);
        } catch (RocksDBException e) {
            logger.error("Failed to open cache index at {}: {}", path, e.getMessage(), e);
            throw new CacheException("Failed to open RocksDB cache index", path, "open_index", e);
        }
        this.writeOpts = new WriteOptions().setSync(false);
        logger.debug("Opened RocksDB cache index at {}", path);
    }

    private static byte[] keyBytes(String key) {
        return key.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public Optional<CacheEntryMeta> get(String key) {
        try {
            byte[] value = db.get(keyBytes(key));
            return value == null ? Optional.empty() : Optional.of(serializer.deserialize(value, CacheEntryMeta.class));
        } catch (RocksDBException | RuntimeException e) {
            logger.warn("Failed to read index record for '{}' at {}: {}", key, path, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public Collection<CacheEntryMeta> all() {
        List<CacheEntryMeta> out = new ArrayList<>();
        try (RocksIterator it = db.newIterator()) {
            for (it.seekToFirst(); it.isValid(); it.next()) {
                try {
                    out.add(serializer.deserialize(it.value(), CacheEntryMeta.class));
                } catch (RuntimeException e) {
                    logger.warn("Skipping unreadable index record {} at {}",
                            new String(it.key(), StandardCharsets.UTF_8), path);
                }
            }
        }
        return out;
    }

    @Override
    public int size() {
        int n = 0;
        try (RocksIterator it = db.newIterator()) {
            for (it.seekToFirst(); it.isValid(); it.next()) n++;
        }
        return n;
    }

    @Override
    public void put(CacheEntryMeta meta) throws IOException {
        try {
            db.put(writeOpts, keyBytes(meta.key()), serializer.serialize(meta));
        } catch (RocksDBException e) {
            throw new IOException("Failed to write index record for " + meta.key(), e);
        }
    }

    @Override
    public void remove(String key) throws IOException {
        try {
            db.delete(writeOpts, keyBytes(key));
        } catch (RocksDBException e) {
            throw new IOException("Failed to delete index record for " + key, e);
        }
    }

    @Override
    public void removeAll(Collection<String> keys) throws IOException {
        if (keys.isEmpty()) return;
        try (WriteBatch batch = new WriteBatch()) {
            for (String key : keys) {
                batch.delete(keyBytes(key));
            }
            db.write(writeOpts, batch);
        } catch (RocksDBException e) {
            throw new IOException("Failed to delete " + keys.size() + " index records", e);
        }
    }

    @Override
    public void clear() throws IOException {
        List<String> keys = new ArrayList<>();
        try (RocksIterator it = db.newIterator()) {
            for (it.seekToFirst(); it.isValid(); it.next()) {
                keys.add(new String(it.key(), StandardCharsets.UTF_8));
            }
        }
        removeAll(keys);
    }

    @Override
    public void close() {
        try {
            writeOpts.close();
        } catch (Exception e) {
            logger.warn("Failed to close write options for index {}: {}", path, e.getMessage(), e);
        }
        try {
            db.close();
            logger.debug("Closed RocksDB cache index at {}", path);
        } catch (Exception e) {
            logger.warn("Failed to close RocksDB cache index at {}: {}", path, e.getMessage(), e);
        }
    }
}
