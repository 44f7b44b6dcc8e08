package com.yupacgo.backend.otp.entity;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum OtpPurpose {
    PASSWORD_CHANGE,
    EMAIL_VERIFICATION;

    @JsonValue
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
