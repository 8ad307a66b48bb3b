package dev.epwbatch.config;

/**
 * Storage backend for cache entry metadata.
 * <ul>
 *   <li>{@link #JSON_FILE}: one aggregate JSON file, rewritten in full on every mutation.</li>
 *   <li>{@link #ROCKSDB}: one RocksDB record per key; mutations touch a single key.</li>
 * </ul>
 */
public enum IndexType {
    JSON_FILE,
    ROCKSDB
}
