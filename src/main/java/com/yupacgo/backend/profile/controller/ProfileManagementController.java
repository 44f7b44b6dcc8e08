package com.yupacgo.backend.profile.controller;

import com.yupacgo.backend.activity.ActivityAction;
import com.yupacgo.backend.activity.AuditedAction;
import com.yupacgo.backend.auth.dto.UserView;
import com.yupacgo.backend.auth.security.AuthContext;
import com.yupacgo.backend.common.web.ApiResponse;
import com.yupacgo.backend.otp.entity.OtpCode;
import com.yupacgo.backend.otp.service.IssuedOtp;
import com.yupacgo.backend.profile.dto.ChangePasswordRequest;
import com.yupacgo.backend.profile.dto.DeleteAccountRequest;
import com.yupacgo.backend.profile.dto.OtpVerified;
import com.yupacgo.backend.profile.dto.PasswordChangeRequested;
import com.yupacgo.backend.profile.dto.ProfileUpdateView;
import com.yupacgo.backend.profile.dto.UpdateProfileRequest;
import com.yupacgo.backend.profile.dto.VerifyOtpRequest;
import com.yupacgo.backend.profile.service.ProfileManagementService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/profile")
public class ProfileManagementController {

    private final ProfileManagementService profiles;
    private final AuthContext auth;

    public ProfileManagementController(ProfileManagementService profiles, AuthContext auth) {
        this.profiles = profiles;
        this.auth = auth;
    }

    @PostMapping("/request-password-change")
    public ApiResponse<PasswordChangeRequested> requestPasswordChange() {
        IssuedOtp issued = profiles.requestPasswordChange(auth.requireUserId());
        return ApiResponse.ok("OTP sent to your email",
                new PasswordChangeRequested(issued.email(), issued.expiresIn()));
    }

    @PostMapping("/verify-otp")
    public ApiResponse<OtpVerified> verifyOtp(@Valid @RequestBody VerifyOtpRequest body) {
        OtpCode code = profiles.verifyPasswordChangeOtp(auth.requireUserId(), body.otp());
        return ApiResponse.ok("OTP verified successfully", new OtpVerified(code.getId()));
    }

    @AuditedAction(ActivityAction.PASSWORD_CHANGE)
    @PostMapping("/change-password")
    public ApiResponse<Void> changePassword(@RequestBody ChangePasswordRequest body) {
        profiles.changePassword(auth.requireUserId(), body);
        return ApiResponse.ok("Password changed successfully");
    }

    @AuditedAction(value = ActivityAction.PROFILE_UPDATE, details = ProfileUpdateDetails.class)
    @PutMapping("/update")
    public ApiResponse<ProfileUpdateView> update(@Valid @RequestBody UpdateProfileRequest body) {
        return ApiResponse.ok("Profile updated successfully", profiles.updateProfile(auth.requireUserId(), body));
    }

    @GetMapping("/settings")
    public ApiResponse<UserView> settings() {
        return ApiResponse.ok(profiles.settings(auth.requireUserId()));
    }

    @DeleteMapping("/delete-account")
    public ApiResponse<Void> deleteAccount(@RequestBody(required = false) DeleteAccountRequest body) {
        profiles.deleteAccount(auth.requireUserId(), body);
        return ApiResponse.ok("Account deleted successfully");
    }
}
