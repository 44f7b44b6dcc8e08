package com.yupacgo.backend.profile.dto;

/** {@code email} is masked. */
public record PasswordChangeRequested(String email, long expiresIn) {}
