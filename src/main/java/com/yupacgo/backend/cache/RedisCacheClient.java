package com.yupacgo.backend.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.lettuce.core.ClientOptions;
import io.lettuce.core.RedisURI;
import io.lettuce.core.SocketOptions;
import io.lettuce.core.TimeoutOptions;
import io.lettuce.core.resource.ClientResources;
import io.lettuce.core.resource.DefaultClientResources;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisPassword;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Redis-backed {@link CacheClient}. Values are stored as JSON strings.
 * <p>
 * Connection failures and command timeouts are retried per {@link CacheRetryPolicy}; anything
 * still failing after the last attempt, and every other error, is logged and absorbed.
 */
@Slf4j
public class RedisCacheClient implements CacheClient {

    private final StringRedisTemplate redis;
    private final ObjectMapper json;
    private final CacheRetryPolicy retry;
    private final Runnable onShutdown;
    private final AtomicBoolean closed = new AtomicBoolean();

    public RedisCacheClient(StringRedisTemplate redis, ObjectMapper json, CacheRetryPolicy retry, Runnable onShutdown) {
        this.redis = redis;
        this.json = json;
        this.retry = retry;
        this.onShutdown = onShutdown == null ? () -> {} : onShutdown;
    }

    /**
     * Builds a client for a {@code redis://} or {@code rediss://} URL. TLS connections skip
     * peer verification so managed providers with self-signed chains work.
     */
    public static RedisCacheClient connect(String url, ObjectMapper json, CacheRetryPolicy retry, Duration commandTimeout) {
        RedisURI uri = RedisURI.create(url);

        var server = new RedisStandaloneConfiguration(uri.getHost(), uri.getPort());
        server.setDatabase(uri.getDatabase());
        if (uri.getUsername() != null) server.setUsername(uri.getUsername());
        if (uri.getPassword() != null) server.setPassword(RedisPassword.of(uri.getPassword()));

        ClientResources resources = DefaultClientResources.builder()
                .reconnectDelay(new CappedLinearDelay(retry))
                .build();

        ClientOptions options = ClientOptions.builder()
                .autoReconnect(true)
                .disconnectedBehavior(ClientOptions.DisconnectedBehavior.REJECT_COMMANDS)
                .socketOptions(SocketOptions.builder().connectTimeout(commandTimeout).build())
                .timeoutOptions(TimeoutOptions.enabled(commandTimeout))
                .build();

        var client = LettuceClientConfiguration.builder()
                .commandTimeout(commandTimeout)
                .clientResources(resources)
                .clientOptions(options);
        if (uri.isSsl()) {
            client.useSsl().disablePeerVerification();
        }

        var factory = new LettuceConnectionFactory(server, client.build());
        factory.afterPropertiesSet();
        factory.start();

        var template = new StringRedisTemplate(factory);
        log.info("Redis cache configured host={} port={} ssl={}", uri.getHost(), uri.getPort(), uri.isSsl());

        return new RedisCacheClient(template, json, retry, () -> {
            factory.destroy();
            resources.shutdown();
        });
    }

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        String raw = call("GET", key, () -> redis.opsForValue().get(key), null);
        if (raw == null) return Optional.empty();
        try {
            return Optional.ofNullable(json.readValue(raw, type));
        } catch (JsonProcessingException e) {
            log.warn("cache GET decode failed key={}: {}", key, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    @Override
    public void set(String key, Object value, long ttlSeconds) {
        final String raw;
        try {
            raw = json.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("cache SET encode failed key={}: {}", key, e.getOriginalMessage());
            return;
        }
        Duration ttl = Duration.ofSeconds(ttlSeconds > 0 ? ttlSeconds : DEFAULT_TTL_SECONDS);
        call("SET", key, () -> {
            redis.opsForValue().set(key, raw, ttl);
            return Boolean.TRUE;
        }, Boolean.FALSE);
    }

    @Override
    public void delete(String key) {
        call("DEL", key, () -> redis.delete(key), Boolean.FALSE);
    }

    @Override
    public long deleteByPattern(String pattern) {
        Long removed = call("DEL_PATTERN", pattern, () -> {
            Set<String> keys = redis.keys(pattern);
            if (keys == null || keys.isEmpty()) return 0L;
            Long n = redis.delete(keys);
            return n == null ? 0L : n;
        }, 0L);
        if (removed > 0) {
            log.info("cache invalidated pattern={} keys={}", pattern, removed);
        }
        return removed;
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    @Override
    public boolean ping() {
        String pong = call("PING", "-", () -> redis.execute((RedisCallback<String>) RedisConnection::ping), null);
        return "PONG".equalsIgnoreCase(pong);
    }

    @Override
    public void shutdown() {
        if (!closed.compareAndSet(false, true)) return;
        try {
            onShutdown.run();
            log.info("Redis cache connection closed");
        } catch (RuntimeException e) {
            log.warn("Redis cache shutdown failed: {}", e.getMessage());
        }
    }

    private <T> T call(String op, String key, Supplier<T> action, T fallback) {
        if (closed.get()) return fallback;

        for (int attempt = 1; ; attempt++) {
            try {
                return action.get();
            } catch (RedisConnectionFailureException | QueryTimeoutException e) {
                if (attempt >= retry.maxAttempts()) {
                    log.warn("cache {} gave up key={} attempts={}: {}", op, key, attempt, e.getMessage());
                    return fallback;
                }
                log.debug("cache {} attempt={} failed key={}: {}", op, attempt, key, e.getMessage());
                if (!retry.pause(attempt)) return fallback;
            } catch (RuntimeException e) {
                log.warn("cache {} failed key={}: {}", op, key, e.getMessage());
                return fallback;
            }
        }
    }
}
