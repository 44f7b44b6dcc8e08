package com.yupacgo.backend.testsupport;

import com.yupacgo.backend.auth.entity.Role;
import com.yupacgo.backend.auth.entity.User;
import com.yupacgo.backend.auth.repo.UserRepo;
import com.yupacgo.backend.auth.service.TokenService;
import com.yupacgo.backend.otp.service.OtpNotifier;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Primary;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.UUID;

/**
 * Shared base for full-context tests
 * - forces the test profile (H2, no Redis, no mail)
 * - one clock every bean sees, reset before each test
 * - outbound OTP delivery mocked so tests can capture the code
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Import(BaseSpringTest.ClockConfig.class)
public abstract class BaseSpringTest {

    public static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");
    public static final String PASSWORD = "secret123";

    @Autowired protected MockMvc mvc;
    @Autowired protected MutableClock clock;
    @Autowired protected UserRepo users;
    @Autowired protected PasswordEncoder encoder;
    @Autowired protected TokenService tokens;

    @MockitoBean protected OtpNotifier otpNotifier;

    @BeforeEach
    void resetClock() {
        clock.set(T0);
    }

    protected User newUser(Role role) {
        User u = new User();
        u.setFirstname("Ada");
        u.setLastname("Lovelace");
        u.setEmail("u-" + UUID.randomUUID() + "@example.com");
        u.setPasswordHash(encoder.encode(PASSWORD));
        u.setRole(role);
        return users.saveAndFlush(u);
    }

    protected String bearer(User u) {
        return "Bearer " + tokens.issue(u).token();
    }

    @TestConfiguration
    public static class ClockConfig {
        @Bean
        @Primary
        public MutableClock testClock() {
            return new MutableClock(T0);
        }
    }
}
