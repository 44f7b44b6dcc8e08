package com.yupacgo.backend.otp;

import com.yupacgo.backend.otp.entity.OtpPurpose;
import com.yupacgo.backend.otp.service.MailOtpNotifier;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.mail.MailSendException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class MailOtpNotifierTest {

    private final JavaMailSender mail = mock(JavaMailSender.class);

    @Test
    void sends_code_from_configured_sender() {
        var notifier = new MailOtpNotifier(mail, true, "no-reply@yupacgo.app");

        assertThat(notifier.send("ada@example.com", "123456", OtpPurpose.PASSWORD_CHANGE)).isTrue();

        ArgumentCaptor<SimpleMailMessage> captor = ArgumentCaptor.forClass(SimpleMailMessage.class);
        verify(mail).send(captor.capture());
        SimpleMailMessage msg = captor.getValue();
        assertThat(msg.getFrom()).isEqualTo("no-reply@yupacgo.app");
        assertThat(msg.getTo()).containsExactly("ada@example.com");
        assertThat(msg.getSubject()).contains("Password Change");
        assertThat(msg.getText()).contains("123456").contains("5 minutes");
    }

    @Test
    void disabled_mail_reports_not_delivered() {
        var notifier = new MailOtpNotifier(mail, false, "no-reply@yupacgo.app");

        assertThat(notifier.send("ada@example.com", "123456", OtpPurpose.EMAIL_VERIFICATION)).isFalse();
        verifyNoInteractions(mail);
    }

    @Test
    void smtp_failure_reports_not_delivered() {
        doThrow(new MailSendException("smtp down")).when(mail).send(any(SimpleMailMessage.class));
        var notifier = new MailOtpNotifier(mail, true, "no-reply@yupacgo.app");

        assertThat(notifier.send("ada@example.com", "123456", OtpPurpose.PASSWORD_CHANGE)).isFalse();
    }
}
