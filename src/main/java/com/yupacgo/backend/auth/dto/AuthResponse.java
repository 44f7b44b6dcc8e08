package com.yupacgo.backend.auth.dto;

public record AuthResponse(
        String token,
        String tokenType,
        long expiresIn,
        UserView user
) {
    public AuthResponse(String token, long expiresIn, UserView user) {
        this(token, "Bearer", expiresIn, user);
    }
}
