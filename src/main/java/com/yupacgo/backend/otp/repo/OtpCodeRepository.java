package com.yupacgo.backend.otp.repo;

import com.yupacgo.backend.otp.entity.OtpCode;
import com.yupacgo.backend.otp.entity.OtpPurpose;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Optional;

public interface OtpCodeRepository extends JpaRepository<OtpCode, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select o from OtpCode o where o.userId = :userId and o.purpose = :purpose")
    Optional<OtpCode> lockByUserIdAndPurpose(@Param("userId") Long userId, @Param("purpose") OtpPurpose purpose);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select o from OtpCode o where o.id = :id")
    Optional<OtpCode> lockById(@Param("id") Long id);

    Optional<OtpCode> findFirstByUserIdAndPurposeAndCodeHashAndUsedFalseAndExpiresAtAfter(
            Long userId,
            OtpPurpose purpose,
            String codeHash,
            Instant now
    );

    long countByUserIdAndPurposeAndUsedFalseAndExpiresAtAfter(Long userId, OtpPurpose purpose, Instant now);

    @Modifying
    @Query("delete from OtpCode o where o.userId = :userId")
    int deleteAllForUser(@Param("userId") Long userId);
}
