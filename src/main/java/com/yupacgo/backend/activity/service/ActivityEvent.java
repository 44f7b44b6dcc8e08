package com.yupacgo.backend.activity.service;

import com.yupacgo.backend.auth.security.AuthPrincipal;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Everything needed to write one entry, captured on the request thread so the
 * background write never reads request state.
 */
public record ActivityEvent(
        Long userId,
        String action,
        Map<String, Object> details,
        String email,
        String firstname,
        String lastname,
        String ipAddress,
        String userAgent,
        Instant occurredAt
) {
    public static ActivityEvent of(AuthPrincipal p, String action, Map<String, Object> details,
                                   String ip, String userAgent, Instant at) {
        return new ActivityEvent(
                p.userId(), action,
                details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details)),
                p.email(), p.firstname(), p.lastname(),
                ip, userAgent, at
        );
    }
}
