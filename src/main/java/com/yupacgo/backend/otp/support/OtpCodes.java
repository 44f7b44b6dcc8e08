package com.yupacgo.backend.otp.support;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;

public final class OtpCodes {

    private static final SecureRandom SR = new SecureRandom();

    private OtpCodes() {}

    /** Uniform over 100000..999999. */
    public static String newSixDigitCode() {
        return String.valueOf(100_000 + SR.nextInt(900_000));
    }

    public static String sha256Hex(String s) {
        try {
            byte[] d = MessageDigest.getInstance("SHA-256").digest(s.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(d.length * 2);
            for (byte b : d) sb.append(String.format("%02x", b));
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    /**
     * {@code jonathan@example.com} → {@code jo******@example.com}. Keeps at most the first two
     * characters of the local part.
     */
    public static String maskEmail(String email) {
        if (email == null) return null;
        int at = email.indexOf('@');
        if (at <= 0) return "***";

        String local = email.substring(0, at);
        int keep = local.length() <= 2 ? 1 : 2;
        return local.substring(0, keep) + "*".repeat(Math.max(1, local.length() - keep)) + email.substring(at);
    }
}
