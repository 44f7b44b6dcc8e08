package com.yupacgo.backend.activity;

import com.yupacgo.backend.common.web.ApiResponse;
import jakarta.servlet.http.HttpServletRequest;

import java.util.Map;

/**
 * Derives the free-form detail map of an activity entry from the request and the
 * finalized envelope. Runs on the request thread, so it must be cheap and must not
 * touch the store.
 */
@FunctionalInterface
public interface ActivityDetailsExtractor {

    Map<String, Object> extract(HttpServletRequest request, ApiResponse<?> response);

    final class None implements ActivityDetailsExtractor {
        @Override
        public Map<String, Object> extract(HttpServletRequest request, ApiResponse<?> response) {
            return Map.of();
        }
    }
}
