package com.yupacgo.backend.auth.security;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import java.util.Optional;

@Component
public class AuthContext {

    public static final String PRINCIPAL_ATTR = "authPrincipal";

    public Optional<AuthPrincipal> currentPrincipal() {
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        if (auth != null && auth.isAuthenticated() && auth.getPrincipal() instanceof AuthPrincipal p) {
            return Optional.of(p);
        }

        // filter also leaves it on the request
        var attrs = (ServletRequestAttributes) RequestContextHolder.getRequestAttributes();
        if (attrs != null) {
            HttpServletRequest req = attrs.getRequest();
            if (req.getAttribute(PRINCIPAL_ATTR) instanceof AuthPrincipal p) {
                return Optional.of(p);
            }
        }
        return Optional.empty();
    }

    public AuthPrincipal requirePrincipal() {
        return currentPrincipal().orElseThrow(() -> new AuthException(AuthErrorCode.MISSING_CREDENTIAL));
    }

    public Long requireUserId() {
        return requirePrincipal().userId();
    }
}
