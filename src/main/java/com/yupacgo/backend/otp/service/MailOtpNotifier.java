package com.yupacgo.backend.otp.service;

import com.yupacgo.backend.otp.entity.OtpPurpose;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class MailOtpNotifier implements OtpNotifier {

    private final JavaMailSender mail;
    private final boolean enabled;
    private final String sender;

    public MailOtpNotifier(JavaMailSender mail,
                           @Value("${app.email.enabled:true}") boolean enabled,
                           @Value("${app.email.sender:no-reply@yupacgo.app}") String sender) {
        this.mail = mail;
        this.enabled = enabled;
        this.sender = sender;
    }

    @Override
    public boolean send(String email, String code, OtpPurpose purpose) {
        if (!enabled) {
            log.info("Email not configured, OTP not sent purpose={}", purpose);
            return false;
        }

        var msg = new SimpleMailMessage();
        msg.setFrom(sender);
        msg.setTo(email);
        msg.setSubject(subject(purpose));
        msg.setText("Your verification code is: " + code
                + "\nIt will expire in " + OtpService.TTL.toMinutes() + " minutes."
                + "\nIf you did not request this, you can ignore this email.");
        try {
            mail.send(msg);
            return true;
        } catch (MailException e) {
            log.warn("OTP mail delivery failed purpose={}: {}", purpose, e.getMessage());
            return false;
        }
    }

    private static String subject(OtpPurpose purpose) {
        return switch (purpose) {
            case PASSWORD_CHANGE -> "Password Change OTP - Yupacgo";
            case EMAIL_VERIFICATION -> "Verify your email - Yupacgo";
        };
    }
}
