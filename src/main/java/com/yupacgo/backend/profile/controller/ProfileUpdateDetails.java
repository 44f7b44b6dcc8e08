package com.yupacgo.backend.profile.controller;

import com.yupacgo.backend.activity.ActivityDetailsExtractor;
import com.yupacgo.backend.common.web.ApiResponse;
import com.yupacgo.backend.profile.dto.ProfileUpdateView;
import jakarta.servlet.http.HttpServletRequest;

import java.util.Map;

/** {@code {"updatedFields": [...]}} for profile_update entries. */
public class ProfileUpdateDetails implements ActivityDetailsExtractor {

    @Override
    public Map<String, Object> extract(HttpServletRequest request, ApiResponse<?> response) {
        if (response.data() instanceof ProfileUpdateView v) {
            return Map.of("updatedFields", v.updatedFields());
        }
        return Map.of();
    }
}
