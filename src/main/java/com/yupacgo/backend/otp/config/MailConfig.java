package com.yupacgo.backend.otp.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.mail.MailProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.JavaMailSenderImpl;

/**
 * Boot only creates a mail sender when spring.mail.host is set; OTP delivery needs the bean
 * regardless, it simply fails (and reports it) without a host.
 */
@Configuration
@EnableConfigurationProperties(MailProperties.class)
public class MailConfig {

    @Bean
    @ConditionalOnMissingBean(JavaMailSender.class)
    public JavaMailSender javaMailSender(MailProperties p) {
        var s = new JavaMailSenderImpl();
        s.setHost(p.getHost());
        if (p.getPort() != null) s.setPort(p.getPort());
        s.setUsername(p.getUsername());
        s.setPassword(p.getPassword());
        if (p.getDefaultEncoding() != null) s.setDefaultEncoding(p.getDefaultEncoding().name());

        // don't let a dead SMTP server hang the request
        s.getJavaMailProperties().put("mail.smtp.connectiontimeout", "10000");
        s.getJavaMailProperties().put("mail.smtp.timeout", "10000");
        s.getJavaMailProperties().put("mail.smtp.writetimeout", "10000");
        s.getJavaMailProperties().putAll(p.getProperties());
        return s;
    }
}
