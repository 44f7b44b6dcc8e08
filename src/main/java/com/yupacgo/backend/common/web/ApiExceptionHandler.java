package com.yupacgo.backend.common.web;

import com.yupacgo.backend.auth.security.AuthException;
import com.yupacgo.backend.market.client.QuoteUpstreamException;
import com.yupacgo.backend.otp.service.OtpException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.NoSuchElementException;

/**
 * Maps exceptions escaping controllers to the {@link ApiResponse} error envelope:
 * <ul>
 *   <li>auth / OTP failures: the status carried by their code</li>
 *   <li>400: bad input (VALIDATION_FAILED, BAD_REQUEST)</li>
 *   <li>404: unknown resource</li>
 *   <li>502: quote provider failure</li>
 *   <li>500: everything else, with the request id so it can be found in the log</li>
 * </ul>
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(AuthException.class)
    public ResponseEntity<ApiResponse<Void>> handleAuth(AuthException ex, HttpServletRequest req) {
        return ResponseEntity.status(ex.getCode().status())
                .body(err(ex.getCode().name(), ex.getMessage(), req));
    }

    @ExceptionHandler(OtpException.class)
    public ResponseEntity<ApiResponse<Void>> handleOtp(OtpException ex, HttpServletRequest req) {
        return ResponseEntity.status(ex.getCode().status())
                .body(err(ex.getCode().name(), ex.getMessage(), req));
    }

    // ===== 400 =====

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ApiResponse<Void>> handleValidation(ValidationException ex, HttpServletRequest req) {
        return ResponseEntity.badRequest().body(err("VALIDATION_FAILED", ex.getMessage(), req));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> handleBeanValidation(MethodArgumentNotValidException ex,
                                                                  HttpServletRequest req) {
        FieldError first = ex.getBindingResult().getFieldError();
        String msg = first == null ? "Validation failed" : first.getDefaultMessage();
        return ResponseEntity.badRequest().body(err("VALIDATION_FAILED", msg, req));
    }

    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ApiResponse<Void>> handleBadRequest(Exception ex, HttpServletRequest req) {
        String msg = ex instanceof HttpMessageNotReadableException
                ? "Malformed request body"
                : ex.getMessage();
        return ResponseEntity.badRequest().body(err("BAD_REQUEST", msg, req));
    }

    // ===== 404 / 405 =====

    @ExceptionHandler(NoSuchElementException.class)
    public ResponseEntity<ApiResponse<Void>> handleNoSuch(NoSuchElementException ex, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(err("NOT_FOUND", ex.getMessage(), req));
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ApiResponse<Void>> handleNoResource(NoResourceFoundException ex, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(err("NOT_FOUND", "Route not found", req));
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ApiResponse<Void>> handleMethod(HttpRequestMethodNotSupportedException ex,
                                                          HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED)
                .body(err("METHOD_NOT_ALLOWED", ex.getMessage(), req));
    }

    // ===== 502 =====

    @ExceptionHandler(QuoteUpstreamException.class)
    public ResponseEntity<ApiResponse<Void>> handleUpstream(QuoteUpstreamException ex, HttpServletRequest req) {
        log.warn("quote upstream failure status={} code={}", ex.getStatus(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(err("UPSTREAM_ERROR", "Market data provider unavailable", req));
    }

    // ===== 500 =====

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleUnknown(Exception ex, HttpServletRequest req) {
        log.error("Unhandled error {} {} rid={}", req.getMethod(), req.getRequestURI(), RequestIdFilter.current(req), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(err("INTERNAL_ERROR", "Server error", req));
    }

    private static ApiResponse<Void> err(String code, String message, HttpServletRequest req) {
        return ApiResponse.error(code, message, RequestIdFilter.current(req));
    }
}
