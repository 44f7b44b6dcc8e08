package com.yupacgo.backend.common.web;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Envelope returned by every endpoint.
 * <p>
 * Success: {@code {"status":"success","message":...,"data":...}}<br>
 * Failure: {@code {"status":"error","code":"INVALID_CREDENTIAL","message":...,"requestId":...}}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(
        String status,
        String code,
        String message,
        T data,
        String requestId
) {
    public static final String SUCCESS = "success";
    public static final String ERROR = "error";

    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(SUCCESS, null, null, data, null);
    }

    public static <T> ApiResponse<T> ok(String message, T data) {
        return new ApiResponse<>(SUCCESS, null, message, data, null);
    }

    public static ApiResponse<Void> ok(String message) {
        return new ApiResponse<>(SUCCESS, null, message, null, null);
    }

    public static ApiResponse<Void> error(String code, String message, String requestId) {
        return new ApiResponse<>(ERROR, code, message, null, requestId);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return SUCCESS.equals(status);
    }
}
