package com.yupacgo.backend.profile.dto;

public record OtpVerified(Long otpId) {}
