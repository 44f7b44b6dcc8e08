package com.yupacgo.backend.auth.service;

import com.yupacgo.backend.auth.dto.AuthResponse;
import com.yupacgo.backend.auth.dto.LoginRequest;
import com.yupacgo.backend.auth.dto.SignupRequest;
import com.yupacgo.backend.auth.dto.UserView;
import com.yupacgo.backend.auth.entity.Role;
import com.yupacgo.backend.auth.entity.User;
import com.yupacgo.backend.auth.repo.UserRepo;
import com.yupacgo.backend.auth.security.AuthErrorCode;
import com.yupacgo.backend.auth.security.AuthException;
import com.yupacgo.backend.common.web.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Locale;

@Slf4j
@Service
public class AccountService {

    private final UserRepo users;
    private final PasswordEncoder encoder;
    private final TokenService tokens;

    public AccountService(UserRepo users, PasswordEncoder encoder, TokenService tokens) {
        this.users = users;
        this.encoder = encoder;
        this.tokens = tokens;
    }

    @Transactional
    public User signup(SignupRequest req) {
        final String email = req.email().trim().toLowerCase(Locale.ROOT);
        if (users.existsByEmailIgnoreCase(email)) {
            throw new ValidationException("Email already exists");
        }

        User u = new User();
        u.setFirstname(req.firstname().trim());
        u.setLastname(req.lastname().trim());
        u.setEmail(email);
        u.setPasswordHash(encoder.encode(req.password()));
        u.setRole(Role.USER);
        u = users.save(u);

        log.info("user signed up userId={}", u.getId());
        return u;
    }

    /**
     * Unknown email and wrong password are indistinguishable to the caller.
     */
    @Transactional(readOnly = true)
    public LoginResult login(LoginRequest req) {
        User u = users.findByEmailIgnoreCase(req.email().trim())
                .filter(found -> encoder.matches(req.password(), found.getPasswordHash()))
                .orElseThrow(() -> new AuthException(AuthErrorCode.INVALID_LOGIN));

        TokenService.IssuedToken issued = tokens.issue(u);
        return new LoginResult(u, new AuthResponse(issued.token(), issued.expiresInSeconds(), UserView.of(u)));
    }

    public record LoginResult(User user, AuthResponse response) {}
}
