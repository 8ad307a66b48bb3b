package dev.epwbatch.api;

import java.time.Duration;
import java.util.Optional;

final class DisabledCacheStore implements CacheStore {
    static final DisabledCacheStore INSTANCE = new DisabledCacheStore();

    private DisabledCacheStore() {}

    @Override
    public boolean has(String key) {
        return false;
    }

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        return Optional.empty();
    }

    @Override
    public void set(String key, Object value) {
    }

    @Override
    public void set(String key, Object value, Duration ttl) {
    }

    @Override
    public void set(String key, Object value, Duration ttl, DataType dataType) {
    }

    @Override
    public boolean delete(String key) {
        return false;
    }

    @Override
    public void clear() {
    }

    @Override
    public CacheStats stats() {
        return CacheStats.empty(0L);
    }

    @Override
    public int purgeExpired() {
        return 0;
    }

    @Override
    public void close() {
    }

    @Override
    public String toString() {
        return "CacheStore.disabled()";
    }
}
