package com.yupacgo.backend.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class CacheConfigTest {

    private final ObjectMapper om = new ObjectMapper();

    @Test
    void no_url_means_disabled_cache() {
        assertThat(CacheConfig.create(null, om, CacheRetryPolicy.DEFAULT, Duration.ofSeconds(1)))
                .isInstanceOf(DisabledCacheClient.class);
        assertThat(CacheConfig.create("  ", om, CacheRetryPolicy.DEFAULT, Duration.ofSeconds(1)))
                .isInstanceOf(DisabledCacheClient.class);
    }

    @Test
    void unusable_url_falls_back_to_disabled_cache() {
        assertThat(CacheConfig.create("http://localhost:6379", om, CacheRetryPolicy.DEFAULT, Duration.ofSeconds(1)))
                .isInstanceOf(DisabledCacheClient.class);
    }

    @Test
    void redis_url_builds_a_redis_client_without_connecting() {
        CacheClient c = CacheConfig.create("redis://localhost:6390/2", om, CacheRetryPolicy.DEFAULT, Duration.ofMillis(200));
        try {
            assertThat(c).isInstanceOf(RedisCacheClient.class);
            assertThat(c.isEnabled()).isTrue();
        } finally {
            c.shutdown();
        }
    }

    @Test
    void disabled_cache_misses_and_drops_everything() {
        CacheClient c = new DisabledCacheClient();

        c.set("k", "v");
        assertThat(c.get("k", String.class)).isEmpty();
        assertThat(c.deleteByPattern("*")).isZero();
        assertThat(c.isEnabled()).isFalse();
        assertThat(c.ping()).isFalse();
    }
}
