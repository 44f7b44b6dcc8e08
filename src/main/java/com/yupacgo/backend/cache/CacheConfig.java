package com.yupacgo.backend.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Redis is optional. Without {@code app.cache.redis-url}, or if the client cannot be built,
 * the application runs with a {@link DisabledCacheClient}.
 */
@Slf4j
@Configuration
public class CacheConfig {

    @Bean(destroyMethod = "shutdown")
    public CacheClient cacheClient(
            @Value("${app.cache.redis-url:}") String redisUrl,
            @Value("${app.cache.max-attempts:3}") int maxAttempts,
            @Value("${app.cache.base-delay-ms:50}") long baseDelayMs,
            @Value("${app.cache.max-delay-ms:2000}") long maxDelayMs,
            @Value("${app.cache.command-timeout-ms:2000}") long commandTimeoutMs,
            ObjectMapper objectMapper
    ) {
        var retry = new CacheRetryPolicy(maxAttempts, Duration.ofMillis(baseDelayMs), Duration.ofMillis(maxDelayMs));
        return create(redisUrl, objectMapper, retry, Duration.ofMillis(commandTimeoutMs));
    }

    static CacheClient create(String redisUrl, ObjectMapper json, CacheRetryPolicy retry, Duration commandTimeout) {
        if (redisUrl == null || redisUrl.isBlank()) {
            log.warn("Redis URL not configured. Caching disabled.");
            return new DisabledCacheClient();
        }
        try {
            return RedisCacheClient.connect(redisUrl.trim(), json, retry, commandTimeout);
        } catch (RuntimeException e) {
            log.error("Redis cache init failed, caching disabled: {}", e.getMessage());
            return new DisabledCacheClient();
        }
    }
}
