package com.yupacgo.backend.otp.service;

import com.yupacgo.backend.otp.entity.OtpCode;
import com.yupacgo.backend.otp.entity.OtpPurpose;
import com.yupacgo.backend.otp.repo.OtpCodeRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

/**
 * Transactional writes behind {@link OtpService}. Kept in its own bean so mail delivery
 * happens after the row lock is released.
 */
@Component
public class OtpCodeStore {

    private final OtpCodeRepository codes;

    public OtpCodeStore(OtpCodeRepository codes) {
        this.codes = codes;
    }

    /**
     * Replaces whatever code the (user, purpose) pair had with a fresh one. The row is locked
     * for the duration; the unique key on (user_id, purpose) catches two first-time inserts
     * racing each other.
     */
    @Transactional
    public OtpCode upsert(Long userId, String email, OtpPurpose purpose, String codeHash,
                          Instant now, Instant expiresAt) {
        OtpCode row = codes.lockByUserIdAndPurpose(userId, purpose).orElseGet(OtpCode::new);

        row.setUserId(userId);
        row.setEmail(email);
        row.setPurpose(purpose);
        row.setCodeHash(codeHash);
        row.setUsed(false);
        row.setUsedAt(null);
        row.setCreatedAt(now);
        row.setExpiresAt(expiresAt);
        return codes.saveAndFlush(row);
    }

    /**
     * Runs {@code mutation} and marks the code used in the same transaction. If the mutation
     * throws, the transaction rolls back and the code stays live.
     */
    @Transactional
    public OtpCode consume(OtpCode verified, OtpPurpose expected, Runnable mutation, Instant now) {
        if (verified.getPurpose() != expected) {
            throw new OtpException(OtpErrorCode.PURPOSE_MISMATCH);
        }

        OtpCode row = codes.lockById(verified.getId())
                .orElseThrow(() -> new OtpException(OtpErrorCode.NOT_FOUND_OR_EXPIRED));

        // a re-issue between verify and consume reuses the row with a different code
        if (!row.getCodeHash().equals(verified.getCodeHash())) {
            throw new OtpException(OtpErrorCode.NOT_FOUND_OR_EXPIRED);
        }
        if (row.isUsed()) {
            throw new OtpException(OtpErrorCode.ALREADY_USED);
        }
        if (!row.getExpiresAt().isAfter(now)) {
            throw new OtpException(OtpErrorCode.NOT_FOUND_OR_EXPIRED);
        }

        mutation.run();

        row.setUsed(true);
        row.setUsedAt(now);
        return codes.save(row);
    }
}
