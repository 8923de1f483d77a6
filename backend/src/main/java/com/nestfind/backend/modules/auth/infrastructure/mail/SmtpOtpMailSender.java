package com.nestfind.backend.modules.auth.infrastructure.mail;

import java.time.Duration;

import com.nestfind.backend.modules.auth.application.OtpMailSender;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;

public class SmtpOtpMailSender implements OtpMailSender {

    private static final Logger log = LoggerFactory.getLogger(SmtpOtpMailSender.class);

    private final JavaMailSender mailSender;
    private final String from;
    private final Duration otpTtl;

    public SmtpOtpMailSender(JavaMailSender mailSender, String from, Duration otpTtl) {
        this.mailSender = mailSender;
        this.from = from;
        this.otpTtl = otpTtl;
    }

    @Override
    public void sendOtp(String email, String code) {
        SimpleMailMessage message = new SimpleMailMessage();
        message.setFrom(from);
        message.setTo(email);
        message.setSubject("[NestFind] Your verification code");
        message.setText("""
                Your NestFind verification code is %s

                It expires in %d minutes. If you did not request it, you can ignore this email.
                """.formatted(code, otpTtl.toMinutes()));
        mailSender.send(message);
        log.info("Verification code mailed to {}", mask(email));
    }

    static String mask(String email) {
        int at = email.indexOf('@');
        if (at <= 1) {
            return "***" + (at >= 0 ? email.substring(at) : "");
        }
        return email.charAt(0) + "***" + email.substring(at);
    }
}
