package com.yupacgo.backend.auth.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.yupacgo.backend.auth.entity.Role;
import com.yupacgo.backend.common.web.ApiResponse;
import com.yupacgo.backend.common.web.RequestIdFilter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;

/**
 * Bearer gate for everything outside {@code /auth} and {@code /actuator}.
 * Paths under {@link #ADMIN_PREFIX} require {@link Role#ADMIN}; the rest require any valid user.
 * Failures are answered here with the standard envelope and the handler never runs.
 */
@Slf4j
@Component
public class AccessTokenFilter extends OncePerRequestFilter {

    public static final String ADMIN_PREFIX = "/api/admin";

    private final AuthGate gate;
    private final ObjectMapper om;

    public AccessTokenFilter(AuthGate gate, ObjectMapper om) {
        this.gate = gate;
        this.om = om;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String p = request.getRequestURI();
        return p.startsWith("/auth/") || p.startsWith("/actuator") || p.equals("/error");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {

        Role required = req.getRequestURI().startsWith(ADMIN_PREFIX) ? Role.ADMIN : Role.USER;

        AuthPrincipal principal;
        try {
            principal = gate.authenticate(req.getHeader(HttpHeaders.AUTHORIZATION), required);
        } catch (AuthException e) {
            log.debug("auth rejected {} {} code={}", req.getMethod(), req.getRequestURI(), e.getCode());
            write(req, res, e.getCode().status(), e.getCode().name(), e.getCode().message());
            return;
        } catch (RuntimeException e) {
            log.error("auth gate failed {} {}", req.getMethod(), req.getRequestURI(), e);
            write(req, res, HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Server error during authentication.");
            return;
        }

        var authentication = new UsernamePasswordAuthenticationToken(
                principal,
                null,
                List.of(new SimpleGrantedAuthority(principal.role().authority()))
        );
        authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(req));
        SecurityContextHolder.getContext().setAuthentication(authentication);

        req.setAttribute(AuthContext.PRINCIPAL_ATTR, principal);

        chain.doFilter(req, res);
    }

    private void write(HttpServletRequest req, HttpServletResponse res,
                       HttpStatus status, String code, String message) throws IOException {
        res.setStatus(status.value());
        res.setContentType(MediaType.APPLICATION_JSON_VALUE);
        om.writeValue(res.getWriter(), ApiResponse.error(code, message, RequestIdFilter.current(req)));
    }
}
