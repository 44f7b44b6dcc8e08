package com.yupacgo.backend.admin.dto;

import com.yupacgo.backend.auth.dto.UserView;

import java.util.List;

/** {@code page} is 1-based. */
public record UserPage(List<UserView> users, int page, int limit, long total, int totalPages) {}
