package com.yupacgo.backend.profile.service;

import com.yupacgo.backend.auth.dto.UserView;
import com.yupacgo.backend.auth.entity.User;
import com.yupacgo.backend.auth.repo.UserRepo;
import com.yupacgo.backend.common.web.ValidationException;
import com.yupacgo.backend.otp.entity.OtpCode;
import com.yupacgo.backend.otp.entity.OtpPurpose;
import com.yupacgo.backend.otp.repo.OtpCodeRepository;
import com.yupacgo.backend.otp.service.IssuedOtp;
import com.yupacgo.backend.otp.service.OtpService;
import com.yupacgo.backend.profile.dto.ChangePasswordRequest;
import com.yupacgo.backend.profile.dto.DeleteAccountRequest;
import com.yupacgo.backend.profile.dto.ProfileUpdateView;
import com.yupacgo.backend.profile.dto.UpdateProfileRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

@Slf4j
@Service
public class ProfileManagementService {

    static final int MIN_PASSWORD_LENGTH = 6;

    private final UserRepo users;
    private final OtpService otp;
    private final OtpCodeRepository otpCodes;
    private final PasswordEncoder encoder;
    private final Clock clock;

    public ProfileManagementService(UserRepo users,
                                    OtpService otp,
                                    OtpCodeRepository otpCodes,
                                    PasswordEncoder encoder,
                                    Clock clock) {
        this.users = users;
        this.otp = otp;
        this.otpCodes = otpCodes;
        this.encoder = encoder;
        this.clock = clock;
    }

    public IssuedOtp requestPasswordChange(Long userId) {
        return otp.issue(userId, OtpPurpose.PASSWORD_CHANGE);
    }

    public OtpCode verifyPasswordChangeOtp(Long userId, String code) {
        if (isBlank(code)) throw new ValidationException("OTP is required");
        return otp.verify(userId, OtpPurpose.PASSWORD_CHANGE, code);
    }

    /**
     * The password update and the OTP consumption commit together; if the update fails the
     * code can be used again.
     */
    public void changePassword(Long userId, ChangePasswordRequest req) {
        if (req == null || isBlank(req.otp()) || isBlank(req.newPassword()) || isBlank(req.confirmPassword())) {
            throw new ValidationException("All fields are required");
        }
        if (!req.newPassword().equals(req.confirmPassword())) {
            throw new ValidationException("Passwords do not match");
        }
        if (req.newPassword().length() < MIN_PASSWORD_LENGTH) {
            throw new ValidationException("Password must be at least " + MIN_PASSWORD_LENGTH + " characters");
        }

        final String hash = encoder.encode(req.newPassword());
        otp.verifyAndConsume(userId, OtpPurpose.PASSWORD_CHANGE, req.otp(), () -> {
            int n = users.updatePasswordHash(userId, hash, clock.instant());
            if (n == 0) throw new NoSuchElementException("User not found");
        });
        log.info("password changed userId={}", userId);
    }

    @Transactional
    public ProfileUpdateView updateProfile(Long userId, UpdateProfileRequest req) {
        User u = load(userId);
        List<String> changed = new ArrayList<>(2);

        if (req.firstname() != null && !isBlank(req.firstname())
                && !Objects.equals(u.getFirstname(), req.firstname().trim())) {
            u.setFirstname(req.firstname().trim());
            changed.add("firstname");
        }
        if (req.lastname() != null && !isBlank(req.lastname())
                && !Objects.equals(u.getLastname(), req.lastname().trim())) {
            u.setLastname(req.lastname().trim());
            changed.add("lastname");
        }

        if (!changed.isEmpty()) u = users.save(u);
        return new ProfileUpdateView(UserView.of(u), List.copyOf(changed));
    }

    @Transactional(readOnly = true)
    public UserView settings(Long userId) {
        return UserView.of(load(userId));
    }

    /** Activity history is kept; the user row and any OTP rows go. */
    @Transactional
    public void deleteAccount(Long userId, DeleteAccountRequest req) {
        if (req == null || isBlank(req.password())) {
            throw new ValidationException("Password is required to delete account");
        }
        User u = load(userId);
        if (!encoder.matches(req.password(), u.getPasswordHash())) {
            throw new ValidationException("Invalid password");
        }

        otpCodes.deleteAllForUser(userId);
        users.delete(u);
        log.info("account deleted userId={}", userId);
    }

    private User load(Long userId) {
        return users.findById(userId).orElseThrow(() -> new NoSuchElementException("User not found"));
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
