package com.yupacgo.backend.otp.service;

import com.yupacgo.backend.otp.entity.OtpPurpose;

/**
 * Outbound delivery of a freshly issued code. Implementations report failure through the
 * return value and do not retry.
 */
public interface OtpNotifier {

    boolean send(String email, String code, OtpPurpose purpose);
}
