package com.yupacgo.backend.auth.security;

import org.springframework.http.HttpStatus;

/**
 * Stable external contract for auth failures. "user not found" and "bad signature"
 * both map to {@link #INVALID_CREDENTIAL}.
 */
public enum AuthErrorCode {

    MISSING_CREDENTIAL(HttpStatus.UNAUTHORIZED, "Access denied. No token provided."),
    INVALID_CREDENTIAL(HttpStatus.UNAUTHORIZED, "Invalid token."),
    CREDENTIAL_EXPIRED(HttpStatus.UNAUTHORIZED, "Token expired."),
    INSUFFICIENT_ROLE(HttpStatus.FORBIDDEN, "Access denied. Admin privileges required."),
    INVALID_LOGIN(HttpStatus.UNAUTHORIZED, "Invalid credentials");

    private final HttpStatus status;
    private final String message;

    AuthErrorCode(HttpStatus status, String message) {
        this.status = status;
        this.message = message;
    }

    public HttpStatus status() {
        return status;
    }

    public String message() {
        return message;
    }
}
