package com.yupacgo.backend.auth.security;

import com.yupacgo.backend.auth.entity.Role;
import com.yupacgo.backend.auth.entity.User;

/**
 * Sanitized identity attached to a request after the gate passes. Built fresh from the
 * user row on every request; carries no password material.
 */
public record AuthPrincipal(
        Long userId,
        String email,
        String firstname,
        String lastname,
        Role role
) {
    public static AuthPrincipal from(User u) {
        return new AuthPrincipal(u.getId(), u.getEmail(), u.getFirstname(), u.getLastname(), u.getRole());
    }
}
