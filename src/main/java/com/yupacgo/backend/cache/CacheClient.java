package com.yupacgo.backend.cache;

import java.util.Optional;

/**
 * Best-effort key/value cache. No operation ever throws to the caller: a miss, a decode
 * failure and an unreachable backend all look the same ({@link Optional#empty()}, or a write
 * that silently did nothing).
 */
public interface CacheClient {

    long DEFAULT_TTL_SECONDS = 60;

    <T> Optional<T> get(String key, Class<T> type);

    default void set(String key, Object value) {
        set(key, value, DEFAULT_TTL_SECONDS);
    }

    /** A non-positive ttl falls back to {@link #DEFAULT_TTL_SECONDS}. */
    void set(String key, Object value, long ttlSeconds);

    void delete(String key);

    /**
     * Removes every key matching a glob pattern such as {@code quote:*}.
     *
     * @return number of keys removed, 0 when disabled or on failure
     */
    long deleteByPattern(String pattern);

    boolean isEnabled();

    /** True when the backend answered a PING. */
    boolean ping();

    /** Releases connections. Idempotent. */
    void shutdown();
}
