package com.yupacgo.backend.admin.dto;

public record CacheInvalidation(String pattern, long removed) {}
