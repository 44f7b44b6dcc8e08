package com.yupacgo.backend.auth;

import com.yupacgo.backend.auth.entity.Role;
import com.yupacgo.backend.auth.entity.User;
import com.yupacgo.backend.auth.repo.UserRepo;
import com.yupacgo.backend.auth.security.AuthErrorCode;
import com.yupacgo.backend.auth.security.AuthException;
import com.yupacgo.backend.auth.security.AuthGate;
import com.yupacgo.backend.auth.security.AuthPrincipal;
import com.yupacgo.backend.auth.service.TokenService;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

class AuthGateTest {

    private final TokenService tokens = mock(TokenService.class);
    private final UserRepo users = mock(UserRepo.class);
    private final AuthGate gate = new AuthGate(tokens, users);

    @Test
    void missing_header_is_rejected_before_any_lookup() {
        assertThatThrownBy(() -> gate.authenticate(null, Role.ADMIN))
                .isInstanceOf(AuthException.class)
                .extracting(e -> ((AuthException) e).getCode())
                .isEqualTo(AuthErrorCode.MISSING_CREDENTIAL);

        assertThatThrownBy(() -> gate.authenticate("Bearer   ", Role.USER))
                .extracting(e -> ((AuthException) e).getCode())
                .isEqualTo(AuthErrorCode.MISSING_CREDENTIAL);

        assertThatThrownBy(() -> gate.authenticate("Basic dXNlcjpwYXNz", Role.USER))
                .extracting(e -> ((AuthException) e).getCode())
                .isEqualTo(AuthErrorCode.MISSING_CREDENTIAL);

        verifyNoInteractions(tokens, users);
    }

    @Test
    void bad_signature_never_reaches_the_store() {
        when(tokens.verifySubject("junk")).thenThrow(new AuthException(AuthErrorCode.INVALID_CREDENTIAL));

        assertThatThrownBy(() -> gate.authenticate("Bearer junk", Role.USER))
                .extracting(e -> ((AuthException) e).getCode())
                .isEqualTo(AuthErrorCode.INVALID_CREDENTIAL);
        verifyNoInteractions(users);
    }

    @Test
    void subject_without_user_row_is_invalid() {
        when(tokens.verifySubject("t")).thenReturn(42L);
        when(users.findById(42L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> gate.authenticate("Bearer t", Role.USER))
                .extracting(e -> ((AuthException) e).getCode())
                .isEqualTo(AuthErrorCode.INVALID_CREDENTIAL);
    }

    @Test
    void plain_user_is_refused_by_admin_gate_but_passes_user_gate() {
        when(tokens.verifySubject("t")).thenReturn(7L);
        when(users.findById(7L)).thenReturn(Optional.of(user(7L, Role.USER)));

        assertThatThrownBy(() -> gate.authenticate("Bearer t", Role.ADMIN))
                .extracting(e -> ((AuthException) e).getCode())
                .isEqualTo(AuthErrorCode.INSUFFICIENT_ROLE);

        AuthPrincipal p = gate.authenticate("bearer t", Role.USER);
        assertThat(p.userId()).isEqualTo(7L);
        assertThat(p.role()).isEqualTo(Role.USER);
    }

    @Test
    void admin_passes_admin_gate_and_principal_has_no_secret() {
        when(tokens.verifySubject("t")).thenReturn(1L);
        when(users.findById(1L)).thenReturn(Optional.of(user(1L, Role.ADMIN)));

        AuthPrincipal p = gate.authenticate("Bearer t", Role.ADMIN);

        assertThat(p.email()).isEqualTo("u1@example.com");
        assertThat(p.toString()).doesNotContain("$2a$");
    }

    @Test
    void store_failure_propagates_untranslated() {
        when(tokens.verifySubject("t")).thenReturn(1L);
        when(users.findById(1L)).thenThrow(new DataAccessResourceFailureException("db down"));

        assertThatThrownBy(() -> gate.authenticate("Bearer t", Role.USER))
                .isInstanceOf(DataAccessResourceFailureException.class);
    }

    private static User user(Long id, Role role) {
        User u = new User();
        u.setId(id);
        u.setEmail("u" + id + "@example.com");
        u.setFirstname("F");
        u.setLastname("L");
        u.setPasswordHash("$2a$10$hash");
        u.setRole(role);
        return u;
    }
}
