package com.yupacgo.backend.otp;

import com.yupacgo.backend.auth.entity.User;
import com.yupacgo.backend.auth.repo.UserRepo;
import com.yupacgo.backend.otp.entity.OtpCode;
import com.yupacgo.backend.otp.entity.OtpPurpose;
import com.yupacgo.backend.otp.repo.OtpCodeRepository;
import com.yupacgo.backend.otp.service.IssuedOtp;
import com.yupacgo.backend.otp.service.OtpCodeStore;
import com.yupacgo.backend.otp.service.OtpNotifier;
import com.yupacgo.backend.otp.service.OtpService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.PessimisticLockingFailureException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/** Two first-time issues for the same (user, purpose) racing each other. */
class OtpServiceRetryTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private OtpCodeStore store;
    private OtpNotifier notifier;
    private OtpService service;

    @BeforeEach
    void setUp() {
        store = mock(OtpCodeStore.class);
        notifier = mock(OtpNotifier.class);
        UserRepo users = mock(UserRepo.class);

        User u = new User();
        u.setId(7L);
        u.setEmail("racer@example.com");
        when(users.findById(7L)).thenReturn(Optional.of(u));
        when(notifier.send(anyString(), anyString(), any())).thenReturn(true);

        service = new OtpService(mock(OtpCodeRepository.class), store, users, notifier,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private void upsertFailsOnceWith(RuntimeException first) {
        when(store.upsert(eq(7L), anyString(), eq(OtpPurpose.PASSWORD_CHANGE), anyString(), any(), any()))
                .thenThrow(first)
                .thenReturn(new OtpCode());
    }

    @Test
    void innodb_lock_wait_on_first_insert_is_retried() {
        upsertFailsOnceWith(new CannotAcquireLockException("Lock wait timeout exceeded"));

        IssuedOtp issued = service.issue(7L, OtpPurpose.PASSWORD_CHANGE);

        assertThat(issued.delivered()).isTrue();
        assertThat(issued.expiresIn()).isEqualTo(300);
        verify(store, times(2)).upsert(eq(7L), eq("racer@example.com"), eq(OtpPurpose.PASSWORD_CHANGE),
                anyString(), eq(NOW), eq(NOW.plusSeconds(300)));
        verify(notifier, times(1)).send(eq("racer@example.com"), anyString(), eq(OtpPurpose.PASSWORD_CHANGE));
    }

    @Test
    void deadlock_victim_is_retried() {
        upsertFailsOnceWith(new PessimisticLockingFailureException("Deadlock found when trying to get lock"));

        assertThat(service.issue(7L, OtpPurpose.PASSWORD_CHANGE).delivered()).isTrue();
        verify(store, times(2)).upsert(any(), any(), any(), any(), any(), any());
    }

    @Test
    void unique_key_violation_is_retried() {
        upsertFailsOnceWith(new DataIntegrityViolationException("uq_otp_user_purpose"));

        assertThat(service.issue(7L, OtpPurpose.PASSWORD_CHANGE).delivered()).isTrue();
        verify(store, times(2)).upsert(any(), any(), any(), any(), any(), any());
    }

    @Test
    void second_failure_propagates_and_nothing_is_sent() {
        when(store.upsert(any(), any(), any(), any(), any(), any()))
                .thenThrow(new CannotAcquireLockException("first"))
                .thenThrow(new CannotAcquireLockException("second"));

        assertThatThrownBy(() -> service.issue(7L, OtpPurpose.PASSWORD_CHANGE))
                .isInstanceOf(CannotAcquireLockException.class)
                .hasMessageContaining("second");
        verify(notifier, never()).send(any(), any(), any());
    }
}
