package com.yupacgo.backend.auth.entity;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Role {
    USER,
    ADMIN;

    /**
     * Whether a principal holding this role may pass a gate that requires {@code required}.
     */
    public boolean satisfies(Role required) {
        return switch (required) {
            case USER -> true;
            case ADMIN -> this == ADMIN;
        };
    }

    public String authority() {
        return "ROLE_" + name();
    }

    @JsonValue
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
