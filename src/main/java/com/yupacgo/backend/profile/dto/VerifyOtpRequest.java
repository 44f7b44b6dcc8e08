package com.yupacgo.backend.profile.dto;

import jakarta.validation.constraints.NotBlank;

public record VerifyOtpRequest(@NotBlank(message = "OTP is required") String otp) {}
