package com.yupacgo.backend.otp.service;

import lombok.Getter;

@Getter
public class OtpException extends RuntimeException {

    private final OtpErrorCode code;

    public OtpException(OtpErrorCode code) {
        super(code.message());
        this.code = code;
    }
}
