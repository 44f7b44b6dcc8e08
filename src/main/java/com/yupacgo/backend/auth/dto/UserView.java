package com.yupacgo.backend.auth.dto;

import com.yupacgo.backend.auth.entity.Role;
import com.yupacgo.backend.auth.entity.User;

import java.time.Instant;

/** Outward view of a user row; no password hash. */
public record UserView(
        Long id,
        String firstname,
        String lastname,
        String email,
        Role role,
        Instant createdAt
) {
    public static UserView of(User u) {
        return new UserView(u.getId(), u.getFirstname(), u.getLastname(), u.getEmail(), u.getRole(), u.getCreatedAt());
    }
}
