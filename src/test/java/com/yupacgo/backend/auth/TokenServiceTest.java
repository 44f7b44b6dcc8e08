package com.yupacgo.backend.auth;

import com.yupacgo.backend.auth.entity.User;
import com.yupacgo.backend.auth.security.AuthErrorCode;
import com.yupacgo.backend.auth.security.AuthException;
import com.yupacgo.backend.auth.service.TokenService;
import com.yupacgo.backend.testsupport.MutableClock;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TokenServiceTest {

    private static final String SECRET = "unit-test-secret-0123456789abcdef0123456789";

    private final MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
    private final TokenService tokens = new TokenService(SECRET, 3600, clock);

    @Test
    void issued_token_carries_user_id_as_subject() {
        TokenService.IssuedToken issued = tokens.issue(user(99L));

        assertThat(issued.expiresInSeconds()).isEqualTo(3600);
        assertThat(issued.expiresAt()).isEqualTo(Instant.parse("2026-01-01T01:00:00Z"));
        assertThat(tokens.verifySubject(issued.token())).isEqualTo(99L);
    }

    @Test
    void expired_token_is_reported_as_expired() {
        String token = tokens.issue(user(1L)).token();
        clock.advance(Duration.ofHours(2));

        assertThatThrownBy(() -> tokens.verifySubject(token))
                .isInstanceOf(AuthException.class)
                .extracting(e -> ((AuthException) e).getCode())
                .isEqualTo(AuthErrorCode.CREDENTIAL_EXPIRED);
    }

    @Test
    void token_signed_with_another_secret_is_invalid() {
        var other = new TokenService("another-secret-0123456789abcdef0123456789", 3600, clock);
        String foreign = other.issue(user(1L)).token();

        assertThatThrownBy(() -> tokens.verifySubject(foreign))
                .extracting(e -> ((AuthException) e).getCode())
                .isEqualTo(AuthErrorCode.INVALID_CREDENTIAL);
    }

    @Test
    void garbage_and_tampered_tokens_are_invalid() {
        String[] mine = tokens.issue(user(1L)).token().split("\\.");
        String[] theirs = tokens.issue(user(2L)).token().split("\\.");
        // subject swapped, signature kept
        String tampered = mine[0] + "." + theirs[1] + "." + mine[2];

        assertThatThrownBy(() -> tokens.verifySubject("not-a-jwt"))
                .extracting(e -> ((AuthException) e).getCode())
                .isEqualTo(AuthErrorCode.INVALID_CREDENTIAL);
        assertThatThrownBy(() -> tokens.verifySubject(tampered))
                .extracting(e -> ((AuthException) e).getCode())
                .isEqualTo(AuthErrorCode.INVALID_CREDENTIAL);
    }

    @Test
    void correctly_signed_token_without_expiry_is_invalid() {
        String forever = Jwts.builder()
                .setSubject("1")
                .setIssuedAt(Date.from(clock.instant()))
                .signWith(Keys.hmacShaKeyFor(SECRET.getBytes(StandardCharsets.UTF_8)), SignatureAlgorithm.HS256)
                .compact();

        assertThatThrownBy(() -> tokens.verifySubject(forever))
                .isInstanceOf(AuthException.class)
                .extracting(e -> ((AuthException) e).getCode())
                .isEqualTo(AuthErrorCode.INVALID_CREDENTIAL);
    }

    @Test
    void short_secret_is_refused_at_startup() {
        assertThatThrownBy(() -> new TokenService("too-short", 60, clock))
                .isInstanceOf(RuntimeException.class);
    }

    private static User user(Long id) {
        User u = new User();
        u.setId(id);
        u.setEmail("t@example.com");
        return u;
    }
}
