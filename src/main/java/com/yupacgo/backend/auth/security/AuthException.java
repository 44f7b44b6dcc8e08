package com.yupacgo.backend.auth.security;

import lombok.Getter;

@Getter
public class AuthException extends RuntimeException {

    private final AuthErrorCode code;

    public AuthException(AuthErrorCode code) {
        super(code.message());
        this.code = code;
    }
}
