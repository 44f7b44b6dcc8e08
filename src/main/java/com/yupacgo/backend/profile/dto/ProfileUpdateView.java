package com.yupacgo.backend.profile.dto;

import com.yupacgo.backend.auth.dto.UserView;

import java.util.List;

public record ProfileUpdateView(UserView user, List<String> updatedFields) {}
