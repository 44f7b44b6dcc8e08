package com.yupacgo.backend.auth.service;

import com.yupacgo.backend.auth.entity.User;
import com.yupacgo.backend.auth.security.AuthErrorCode;
import com.yupacgo.backend.auth.security.AuthException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;

/**
 * Stateless HS256 bearer tokens. Nothing is stored server side; the subject is the user id
 * and is resolved against the user table on every request.
 */
@Service
public class TokenService {

    private final Key key;
    private final long accessTtlSeconds;
    private final Clock clock;

    public TokenService(
            @Value("${app.auth.jwt-secret}") String secret,
            @Value("${app.auth.access-ttl-sec:86400}") long accessTtlSeconds, // 1 day
            Clock clock
    ) {
        // hmacShaKeyFor rejects secrets shorter than 256 bits
        this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.accessTtlSeconds = accessTtlSeconds;
        this.clock = clock;
    }

    public IssuedToken issue(User user) {
        Instant now = clock.instant();
        Instant exp = now.plusSeconds(accessTtlSeconds);

        String token = Jwts.builder()
                .setSubject(String.valueOf(user.getId()))
                .claim("email", user.getEmail())
                .setIssuedAt(Date.from(now))
                .setExpiration(Date.from(exp))
                .signWith(key, SignatureAlgorithm.HS256)
                .compact();

        return new IssuedToken(token, accessTtlSeconds, exp);
    }

    /**
     * @return the user id carried in the token subject
     * @throws AuthException {@code CREDENTIAL_EXPIRED} for a well signed but expired token,
     *                       {@code INVALID_CREDENTIAL} for anything else that does not verify,
     *                       including a token without an expiry
     */
    public Long verifySubject(String token) {
        try {
            Claims claims = Jwts.parserBuilder()
                    .setSigningKey(key)
                    .setClock(() -> Date.from(clock.instant()))
                    .build()
                    .parseClaimsJws(token)
                    .getBody();
            // every token we issue expires; one without exp was not minted here
            if (claims.getExpiration() == null) {
                throw new AuthException(AuthErrorCode.INVALID_CREDENTIAL);
            }
            return Long.valueOf(claims.getSubject());
        } catch (ExpiredJwtException e) {
            throw new AuthException(AuthErrorCode.CREDENTIAL_EXPIRED);
        } catch (JwtException | IllegalArgumentException e) {
            // NumberFormatException for a non numeric subject lands here too
            throw new AuthException(AuthErrorCode.INVALID_CREDENTIAL);
        }
    }

    public record IssuedToken(String token, long expiresInSeconds, Instant expiresAt) {}
}
