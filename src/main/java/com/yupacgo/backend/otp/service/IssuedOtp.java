package com.yupacgo.backend.otp.service;

/**
 * What the caller learns about an issued code: where it went (masked) and how long it lives.
 */
public record IssuedOtp(String email, long expiresIn, boolean delivered) {}
