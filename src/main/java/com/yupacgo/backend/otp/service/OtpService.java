package com.yupacgo.backend.otp.service;

import com.yupacgo.backend.auth.entity.User;
import com.yupacgo.backend.auth.repo.UserRepo;
import com.yupacgo.backend.otp.entity.OtpCode;
import com.yupacgo.backend.otp.entity.OtpPurpose;
import com.yupacgo.backend.otp.repo.OtpCodeRepository;
import com.yupacgo.backend.otp.support.OtpCodes;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.NoSuchElementException;

/**
 * Single-use, time-boxed codes guarding sensitive account changes.
 * <p>
 * {@link #verify} is read-only so a client can check a code before committing; only
 * {@link #consume} flips {@code used}, and only after the guarded change succeeded. Between the
 * two calls the same code can be presented again until it is consumed or expires.
 */
@Slf4j
@Service
public class OtpService {

    public static final Duration TTL = Duration.ofMinutes(5);

    private final OtpCodeRepository codes;
    private final OtpCodeStore store;
    private final UserRepo users;
    private final OtpNotifier notifier;
    private final Clock clock;

    public OtpService(OtpCodeRepository codes,
                      OtpCodeStore store,
                      UserRepo users,
                      OtpNotifier notifier,
                      Clock clock) {
        this.codes = codes;
        this.store = store;
        this.users = users;
        this.notifier = notifier;
        this.clock = clock;
    }

    public IssuedOtp issue(Long userId, OtpPurpose purpose) {
        User user = users.findById(userId)
                .orElseThrow(() -> new NoSuchElementException("User not found"));

        final String code = OtpCodes.newSixDigitCode();
        final String hash = OtpCodes.sha256Hex(code);
        final Instant now = clock.instant();

        try {
            store.upsert(userId, user.getEmail(), purpose, hash, now, now.plus(TTL));
        } catch (DataIntegrityViolationException | PessimisticLockingFailureException race) {
            // lost the first-insert race for this pair (unique key on H2, gap-lock deadlock on InnoDB);
            // the winner's row exists now, so lock and overwrite it
            log.debug("otp upsert retry userId={} purpose={}", userId, purpose);
            store.upsert(userId, user.getEmail(), purpose, hash, now, now.plus(TTL));
        }

        boolean delivered = notifier.send(user.getEmail(), code, purpose);
        if (!delivered) {
            log.warn("OTP issued but not delivered userId={} purpose={}", userId, purpose);
        }

        return new IssuedOtp(OtpCodes.maskEmail(user.getEmail()), TTL.toSeconds(), delivered);
    }

    /**
     * @return the live record matching the code; never modifies it
     * @throws OtpException {@code NOT_FOUND_OR_EXPIRED} if no unused, unexpired record matches
     */
    public OtpCode verify(Long userId, OtpPurpose purpose, String code) {
        if (code == null || code.isBlank()) {
            throw new OtpException(OtpErrorCode.NOT_FOUND_OR_EXPIRED);
        }
        return codes.findFirstByUserIdAndPurposeAndCodeHashAndUsedFalseAndExpiresAtAfter(
                userId, purpose, OtpCodes.sha256Hex(code.trim()), clock.instant()
        ).orElseThrow(() -> new OtpException(OtpErrorCode.NOT_FOUND_OR_EXPIRED));
    }

    public OtpCode consume(OtpCode verified, OtpPurpose purpose, Runnable mutation) {
        OtpCode used = store.consume(verified, purpose, mutation, clock.instant());
        log.info("OTP consumed userId={} purpose={}", used.getUserId(), purpose);
        return used;
    }

    /** Verify then consume in one call. */
    public OtpCode verifyAndConsume(Long userId, OtpPurpose purpose, String code, Runnable mutation) {
        return consume(verify(userId, purpose, code), purpose, mutation);
    }
}
