package com.yupacgo.backend.common.web;

import jakarta.servlet.http.HttpServletRequest;

import java.util.Optional;

public final class ClientInfo {

    private ClientInfo() {}

    /** First hop of X-Forwarded-For when present, else the socket address. */
    public static String ip(HttpServletRequest request) {
        String xff = request.getHeader("X-Forwarded-For");
        if (xff != null && !xff.isBlank()) {
            int comma = xff.indexOf(',');
            return (comma >= 0 ? xff.substring(0, comma) : xff).trim();
        }
        return request.getRemoteAddr();
    }

    public static String userAgent(HttpServletRequest request) {
        return Optional.ofNullable(request.getHeader("User-Agent")).orElse("");
    }
}
