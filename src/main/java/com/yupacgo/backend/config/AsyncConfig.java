package com.yupacgo.backend.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Configuration
public class AsyncConfig {

    /**
     * Detached activity writes. A full queue rejects instead of blocking the request thread.
     */
    @Bean("auditExecutor")
    public TaskExecutor auditExecutor(
            @Value("${app.audit.pool-size:2}") int poolSize,
            @Value("${app.audit.queue-capacity:500}") int queueCapacity
    ) {
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(poolSize);
        ex.setMaxPoolSize(poolSize);
        ex.setQueueCapacity(queueCapacity);
        ex.setThreadNamePrefix("audit-");
        ex.setWaitForTasksToCompleteOnShutdown(true);
        ex.setAwaitTerminationSeconds(5);
        ex.initialize();
        return ex;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
