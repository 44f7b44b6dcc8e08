package com.yupacgo.backend.admin.service;

import com.yupacgo.backend.admin.dto.SystemHealth;
import com.yupacgo.backend.cache.CacheClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;

@Slf4j
@Service
public class SystemHealthService {

    private static final int DB_VALIDATION_TIMEOUT_SEC = 2;

    private final DataSource dataSource;
    private final CacheClient cache;
    private final Clock clock;

    public SystemHealthService(DataSource dataSource, CacheClient cache, Clock clock) {
        this.dataSource = dataSource;
        this.cache = cache;
        this.clock = clock;
    }

    /** A disabled cache is not a degradation; an enabled one that does not answer is. */
    public SystemHealth check() {
        boolean dbUp = databaseUp();
        boolean cacheEnabled = cache.isEnabled();
        boolean cacheUp = cacheEnabled && cache.ping();

        String status = dbUp && (!cacheEnabled || cacheUp) ? "healthy" : "degraded";
        return new SystemHealth(
                status,
                dbUp ? "connected" : "disconnected",
                new SystemHealth.CacheStatus(cacheEnabled, cacheUp),
                clock.instant()
        );
    }

    private boolean databaseUp() {
        try (Connection c = dataSource.getConnection()) {
            return c.isValid(DB_VALIDATION_TIMEOUT_SEC);
        } catch (SQLException e) {
            log.warn("database health check failed: {}", e.getMessage());
            return false;
        }
    }
}
