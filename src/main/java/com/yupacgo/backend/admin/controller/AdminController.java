package com.yupacgo.backend.admin.controller;

import com.yupacgo.backend.activity.dto.ActivityLogView;
import com.yupacgo.backend.activity.dto.ActivityStats;
import com.yupacgo.backend.activity.service.ActivityQueryService;
import com.yupacgo.backend.admin.dto.CacheInvalidation;
import com.yupacgo.backend.admin.dto.SystemHealth;
import com.yupacgo.backend.admin.dto.UserPage;
import com.yupacgo.backend.admin.service.AdminUserService;
import com.yupacgo.backend.admin.service.SystemHealthService;
import com.yupacgo.backend.cache.CacheClient;
import com.yupacgo.backend.common.web.ApiResponse;
import com.yupacgo.backend.common.web.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/** Every route here sits behind the admin gate (see AccessTokenFilter and SecurityConfig). */
@Slf4j
@RestController
@RequestMapping("/api/admin")
public class AdminController {

    private final ActivityQueryService activities;
    private final AdminUserService users;
    private final SystemHealthService health;
    private final CacheClient cache;

    public AdminController(ActivityQueryService activities,
                           AdminUserService users,
                           SystemHealthService health,
                           CacheClient cache) {
        this.activities = activities;
        this.users = users;
        this.health = health;
        this.cache = cache;
    }

    @GetMapping("/activities")
    public ApiResponse<List<ActivityLogView>> recentActivities(
            @RequestParam(defaultValue = "50") int limit,
            @RequestParam(defaultValue = "0") int skip) {
        return ApiResponse.ok(activities.recent(limit, skip));
    }

    @GetMapping("/activities/stats")
    public ApiResponse<ActivityStats> activityStats(@RequestParam(defaultValue = "30") int days) {
        return ApiResponse.ok(activities.stats(days));
    }

    @GetMapping("/users/{userId}/activities")
    public ApiResponse<List<ActivityLogView>> userActivities(
            @PathVariable Long userId,
            @RequestParam(defaultValue = "20") int limit) {
        return ApiResponse.ok(activities.forUser(userId, limit));
    }

    @GetMapping("/users")
    public ApiResponse<UserPage> users(
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "20") int limit) {
        return ApiResponse.ok(users.list(page, limit));
    }

    @GetMapping("/system-health")
    public ApiResponse<SystemHealth> systemHealth() {
        return ApiResponse.ok(health.check());
    }

    @DeleteMapping("/cache")
    public ApiResponse<CacheInvalidation> invalidateCache(@RequestParam String pattern) {
        String p = pattern.trim();
        if (!hasLiteralPrefix(p)) {
            throw new ValidationException("A narrower pattern is required");
        }
        long removed = cache.deleteByPattern(p);
        log.info("admin cache invalidation pattern={} removed={}", p, removed);
        return ApiResponse.ok("Cache invalidated", new CacheInvalidation(p, removed));
    }

    /**
     * True when the glob starts with at least one literal character, so KEYS cannot sweep the
     * whole keyspace ({@code quote:*} passes; {@code *}, {@code ?*}, {@code [a-z]*} do not).
     * A backslash escape counts as a glob character here.
     */
    static boolean hasLiteralPrefix(String pattern) {
        if (pattern == null || pattern.isEmpty()) return false;
        char first = pattern.charAt(0);
        return first != '*' && first != '?' && first != '[' && first != '\\';
    }
}
