package com.yupacgo.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration;
import org.springframework.boot.autoconfigure.data.redis.RedisRepositoriesAutoConfiguration;

/**
 * Redis is wired by {@link com.yupacgo.backend.cache.CacheConfig} only when REDIS_URL is set,
 * so Boot's own Redis auto-configuration stays off.
 */
@SpringBootApplication(exclude = {
        RedisAutoConfiguration.class,
        RedisRepositoriesAutoConfiguration.class
})
public class YupacgoApplication {

    public static void main(String[] args) {
        SpringApplication.run(YupacgoApplication.class, args);
    }
}
