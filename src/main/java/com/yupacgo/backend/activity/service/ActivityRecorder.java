package com.yupacgo.backend.activity.service;

import com.yupacgo.backend.activity.entity.ActivityLog;
import com.yupacgo.backend.activity.repo.ActivityLogRepository;
import com.yupacgo.backend.auth.security.AuthPrincipal;
import com.yupacgo.backend.common.web.ClientInfo;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Best-effort activity trail. Writes are handed to {@code auditExecutor} and never awaited;
 * a failed or dropped write is logged and otherwise invisible to the caller.
 */
@Slf4j
@Service
public class ActivityRecorder {

    private final ActivityLogRepository repo;
    private final TaskExecutor executor;
    private final Clock clock;

    public ActivityRecorder(ActivityLogRepository repo,
                            @Qualifier("auditExecutor") TaskExecutor executor,
                            Clock clock) {
        this.repo = repo;
        this.executor = executor;
        this.clock = clock;
    }

    public void recordAsync(ActivityEvent event) {
        try {
            executor.execute(() -> write(event));
        } catch (TaskRejectedException e) {
            log.warn("Activity dropped, audit executor saturated userId={} action={}",
                    event.userId(), event.action());
        }
    }

    /**
     * Manual helper for places where the principal is known but not attached to the request
     * (signup, login).
     */
    public void record(AuthPrincipal principal, String action, Map<String, Object> details,
                       HttpServletRequest request) {
        if (principal == null) return;
        recordAsync(ActivityEvent.of(
                principal, action, details,
                ClientInfo.ip(request), ClientInfo.userAgent(request),
                clock.instant()
        ));
    }

    void write(ActivityEvent e) {
        try {
            ActivityLog row = new ActivityLog();
            row.setUserId(e.userId());
            row.setAction(e.action());
            row.setDetails(new LinkedHashMap<>(e.details()));
            row.setEmail(e.email());
            row.setFirstname(e.firstname());
            row.setLastname(e.lastname());
            row.setIpAddress(e.ipAddress());
            row.setUserAgent(truncate(e.userAgent(), 512));
            row.setOccurredAt(e.occurredAt());
            repo.save(row);
        } catch (RuntimeException ex) {
            log.error("Failed to log activity userId={} action={}", e.userId(), e.action(), ex);
        }
    }

    private static String truncate(String s, int max) {
        if (s == null || s.length() <= max) return s;
        return s.substring(0, max);
    }
}
