package com.yupacgo.backend.admin.dto;

import java.time.Instant;

public record SystemHealth(String status, String database, CacheStatus cache, Instant timestamp) {

    public record CacheStatus(boolean enabled, boolean reachable) {}
}
