package dev.epwbatch.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Keeps every record in one JSON document. Each mutation rewrites the whole file through a temp
 * file and a move, so a crash leaves either the old or the new index on disk.
 */
final class JsonFileCacheIndex implements CacheIndex {
    private static final Logger logger = LoggerFactory.getLogger(JsonFileCacheIndex.class);
    private static final TypeReference<LinkedHashMap<String, CacheEntryMeta>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper mapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .enable(SerializationFeature.INDENT_OUTPUT);
    private final Path file;
    private final Map<String, CacheEntryMeta> entries = new LinkedHashMap<>();

    JsonFileCacheIndex(Path file) {
        this.file = file;
        load();
    }

    private void load() {
        if (!Files.exists(file)) {
            return;
        }
        try {
            Map<String, CacheEntryMeta> loaded = mapper.readValue(file.toFile(), MAP_TYPE);
            if (loaded != null) {
                entries.putAll(loaded);
            }
            logger.debug("Loaded {} cache index records from {}", entries.size(), file);
        } catch (IOException e) {
            logger.warn("Cache index {} is unreadable, starting with an empty index: {}", file, e.getMessage());
            entries.clear();
        }
    }

    private void save() throws IOException {
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        mapper.writeValue(tmp.toFile(), entries);
        try {
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    @Override
    public Optional<CacheEntryMeta> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public Collection<CacheEntryMeta> all() {
        return new ArrayList<>(entries.values());
    }

    @Override
    public int size() {
        return entries.size();
    }

    @Override
    public void put(CacheEntryMeta meta) throws IOException {
        CacheEntryMeta previous = entries.put(meta.key(), meta);
        try {
            save();
        } catch (IOException e) {
            if (previous == null) entries.remove(meta.key());
            else entries.put(meta.key(), previous);
            throw e;
        }
    }

    @Override
    public void remove(String key) throws IOException {
        removeAll(List.of(key));
    }

    @Override
    public void removeAll(Collection<String> keys) throws IOException {
        Map<String, CacheEntryMeta> snapshot = new LinkedHashMap<>(entries);
        boolean changed = false;
        for (String key : keys) {
            changed |= entries.remove(key) != null;
        }
        if (changed) {
            saveOrRestore(snapshot);
        }
    }

    @Override
    public void clear() throws IOException {
        Map<String, CacheEntryMeta> snapshot = new LinkedHashMap<>(entries);
        entries.clear();
        saveOrRestore(snapshot);
    }

    private void saveOrRestore(Map<String, CacheEntryMeta> snapshot) throws IOException {
        try {
            save();
        } catch (IOException e) {
            entries.clear();
            entries.putAll(snapshot);
            throw e;
        }
    }

    @Override
    public void close() {
        entries.clear();
    }
}
