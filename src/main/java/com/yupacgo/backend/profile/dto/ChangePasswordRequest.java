package com.yupacgo.backend.profile.dto;

/** Checked by the service so the messages match the client's expectations exactly. */
public record ChangePasswordRequest(String otp, String newPassword, String confirmPassword) {}
