package com.yupacgo.backend.otp.service;

import org.springframework.http.HttpStatus;

public enum OtpErrorCode {

    NOT_FOUND_OR_EXPIRED(HttpStatus.BAD_REQUEST, "Invalid or expired OTP"),
    ALREADY_USED(HttpStatus.CONFLICT, "OTP already used"),
    PURPOSE_MISMATCH(HttpStatus.BAD_REQUEST, "OTP purpose mismatch");

    private final HttpStatus status;
    private final String message;

    OtpErrorCode(HttpStatus status, String message) {
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
