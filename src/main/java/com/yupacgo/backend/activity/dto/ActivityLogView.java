package com.yupacgo.backend.activity.dto;

import com.yupacgo.backend.activity.entity.ActivityLog;

import java.time.Instant;
import java.util.Map;

public record ActivityLogView(
        Long id,
        Long userId,
        String action,
        Map<String, Object> details,
        UserInfo userInfo,
        String ipAddress,
        String userAgent,
        Instant timestamp
) {
    public record UserInfo(String email, String firstname, String lastname) {}

    public static ActivityLogView of(ActivityLog a) {
        return new ActivityLogView(
                a.getId(),
                a.getUserId(),
                a.getAction(),
                a.getDetails() == null ? Map.of() : a.getDetails(),
                new UserInfo(a.getEmail(), a.getFirstname(), a.getLastname()),
                a.getIpAddress(),
                a.getUserAgent(),
                a.getOccurredAt()
        );
    }
}
