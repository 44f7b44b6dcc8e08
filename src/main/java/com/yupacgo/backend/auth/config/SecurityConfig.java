package com.yupacgo.backend.auth.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.yupacgo.backend.auth.security.AccessTokenFilter;
import com.yupacgo.backend.auth.security.AuthErrorCode;
import com.yupacgo.backend.common.web.ApiResponse;
import com.yupacgo.backend.common.web.RequestIdFilter;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.MediaType;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

import java.io.IOException;

@Configuration
public class SecurityConfig {

    private final AccessTokenFilter accessTokenFilter;
    private final ObjectMapper om;

    public SecurityConfig(AccessTokenFilter accessTokenFilter, ObjectMapper om) {
        this.accessTokenFilter = accessTokenFilter;
        this.om = om;
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder(10);
    }

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        http
                .csrf(csrf -> csrf.disable())
                .cors(Customizer.withDefaults())
                .httpBasic(b -> b.disable())
                .formLogin(f -> f.disable())
                .logout(l -> l.disable())
                .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .authorizeHttpRequests(reg -> reg
                        .requestMatchers("/auth/**", "/actuator/health", "/error").permitAll()
                        .requestMatchers(AccessTokenFilter.ADMIN_PREFIX + "/**").hasRole("ADMIN")
                        .anyRequest().authenticated()
                )
                .addFilterBefore(accessTokenFilter, UsernamePasswordAuthenticationFilter.class)
                // the bearer filter answers first; these only fire for paths it skips
                .exceptionHandling(ex -> ex
                        .authenticationEntryPoint((req, res, e) ->
                                write(req, res, AuthErrorCode.MISSING_CREDENTIAL))
                        .accessDeniedHandler((req, res, e) ->
                                write(req, res, AuthErrorCode.INSUFFICIENT_ROLE))
                );

        return http.build();
    }

    private void write(HttpServletRequest req, HttpServletResponse res, AuthErrorCode code) throws IOException {
        res.setStatus(code.status().value());
        res.setContentType(MediaType.APPLICATION_JSON_VALUE);
        om.writeValue(res.getWriter(), ApiResponse.error(code.name(), code.message(), RequestIdFilter.current(req)));
    }
}
