package com.yupacgo.backend.auth.controller;

import com.yupacgo.backend.activity.ActivityAction;
import com.yupacgo.backend.activity.service.ActivityRecorder;
import com.yupacgo.backend.auth.dto.AuthResponse;
import com.yupacgo.backend.auth.dto.LoginRequest;
import com.yupacgo.backend.auth.dto.SignupRequest;
import com.yupacgo.backend.auth.dto.UserView;
import com.yupacgo.backend.auth.entity.User;
import com.yupacgo.backend.auth.security.AuthPrincipal;
import com.yupacgo.backend.auth.service.AccountService;
import com.yupacgo.backend.common.web.ApiResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/auth")
public class AuthController {

    private final AccountService accounts;
    private final ActivityRecorder activity;

    public AuthController(AccountService accounts, ActivityRecorder activity) {
        this.accounts = accounts;
        this.activity = activity;
    }

    @PostMapping("/signup")
    public ResponseEntity<ApiResponse<UserView>> signup(@Valid @RequestBody SignupRequest body,
                                                        HttpServletRequest req) {
        User u = accounts.signup(body);
        // no principal on the request yet, so these two are recorded by hand
        activity.record(AuthPrincipal.from(u), ActivityAction.USER_SIGNUP, Map.of(), req);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok("Signup successful", UserView.of(u)));
    }

    @PostMapping("/login")
    public ApiResponse<AuthResponse> login(@Valid @RequestBody LoginRequest body, HttpServletRequest req) {
        var result = accounts.login(body);
        activity.record(AuthPrincipal.from(result.user()), ActivityAction.USER_LOGIN, Map.of(), req);
        return ApiResponse.ok("Login successful", result.response());
    }

    @GetMapping("/health")
    public ApiResponse<Void> health() {
        return ApiResponse.ok("OK");
    }
}
