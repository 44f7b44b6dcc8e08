package com.yupacgo.backend.profile.dto;

public record DeleteAccountRequest(String password) {}
