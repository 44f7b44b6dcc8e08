package com.yupacgo.backend.cache;

import java.util.Optional;

/** Used when no Redis URL is configured: every read misses and every write is dropped. */
public final class DisabledCacheClient implements CacheClient {

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        return Optional.empty();
    }

    @Override
    public void set(String key, Object value, long ttlSeconds) {
    }

    @Override
    public void delete(String key) {
    }

    @Override
    public long deleteByPattern(String pattern) {
        return 0;
    }

    @Override
    public boolean isEnabled() {
        return false;
    }

    @Override
    public boolean ping() {
        return false;
    }

    @Override
    public void shutdown() {
    }
}
