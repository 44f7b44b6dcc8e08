package com.yupacgo.backend.auth.security;

import com.yupacgo.backend.auth.entity.Role;
import com.yupacgo.backend.auth.entity.User;
import com.yupacgo.backend.auth.repo.UserRepo;
import com.yupacgo.backend.auth.service.TokenService;
import org.springframework.stereotype.Component;

/**
 * Read-and-decide check run once per protected request, before the handler.
 * <ol>
 *   <li>no bearer credential → {@code MISSING_CREDENTIAL}, nothing else is touched</li>
 *   <li>signature / expiry checked by {@link TokenService}</li>
 *   <li>subject resolved against the user table; unknown subject → {@code INVALID_CREDENTIAL}</li>
 *   <li>role compared with the gate's requirement → {@code INSUFFICIENT_ROLE}</li>
 * </ol>
 * Store failures are not translated here; they propagate and the caller reports them as
 * an internal failure.
 */
@Component
public class AuthGate {

    private static final String BEARER = "Bearer ";

    private final TokenService tokens;
    private final UserRepo users;

    public AuthGate(TokenService tokens, UserRepo users) {
        this.tokens = tokens;
        this.users = users;
    }

    public AuthPrincipal authenticate(String authorizationHeader, Role required) {
        String raw = bearerToken(authorizationHeader);
        if (raw == null) {
            throw new AuthException(AuthErrorCode.MISSING_CREDENTIAL);
        }

        Long userId = tokens.verifySubject(raw);

        User user = users.findById(userId)
                .orElseThrow(() -> new AuthException(AuthErrorCode.INVALID_CREDENTIAL));

        if (!user.getRole().satisfies(required)) {
            throw new AuthException(AuthErrorCode.INSUFFICIENT_ROLE);
        }

        return AuthPrincipal.from(user);
    }

    static String bearerToken(String header) {
        if (header == null || !header.regionMatches(true, 0, BEARER, 0, BEARER.length())) {
            return null;
        }
        String raw = header.substring(BEARER.length()).trim();
        return raw.isEmpty() ? null : raw;
    }
}
