package com.nestfind.backend.modules.auth.infrastructure.mail;

import com.nestfind.backend.modules.auth.application.OtpMailSender;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.mail.MailSendException;

/**
 * Sender used when {@code app.mail.enabled=false}. Every send fails so callers record the code as undelivered.
 * Never logs the code itself.
 */
public class DisabledOtpMailSender implements OtpMailSender {

    private static final Logger log = LoggerFactory.getLogger(DisabledOtpMailSender.class);

    @Override
    public void sendOtp(String email, String code) {
        log.warn("Mail delivery disabled (app.mail.enabled=false); verification code for {} was not sent",
                SmtpOtpMailSender.mask(email));
        throw new MailSendException("Mail delivery disabled");
    }
}
