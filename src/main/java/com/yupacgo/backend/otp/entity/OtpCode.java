package com.yupacgo.backend.otp.entity;

import jakarta.persistence.*;
import lombok.Data;
import lombok.ToString;

import java.time.Instant;

/**
 * One row per (user, purpose). Re-issuing overwrites the row, so at most one code per pair
 * can ever be live. Only the SHA-256 of the code is stored.
 */
@Data
@Entity
@Table(name = "otp_codes",
        uniqueConstraints = @UniqueConstraint(name = "uq_otp_user_purpose", columnNames = {"user_id", "purpose"}))
public class OtpCode {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    // denormalized for delivery and audit
    @Column(nullable = false)
    private String email;

    @ToString.Exclude
    @Column(name = "code_hash", length = 64, nullable = false)
    private String codeHash;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private OtpPurpose purpose;

    @Column(nullable = false)
    private boolean used;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Column(name = "used_at")
    private Instant usedAt;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}
