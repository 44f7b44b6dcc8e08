package com.yupacgo.backend.profile.dto;

import jakarta.validation.constraints.Size;

/** Null fields are left unchanged. */
public record UpdateProfileRequest(
        @Size(max = 100, message = "First name is too long") String firstname,
        @Size(max = 100, message = "Last name is too long") String lastname
) {}
