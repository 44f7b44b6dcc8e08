package com.yupacgo.backend.activity.dto;

public record ActionCount(String action, Long count) {}
