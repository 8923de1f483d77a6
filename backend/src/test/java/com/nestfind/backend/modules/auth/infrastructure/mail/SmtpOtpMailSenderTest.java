package com.nestfind.backend.modules.auth.infrastructure.mail;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import java.time.Duration;

import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;

class SmtpOtpMailSenderTest {

    @Test
    void mailCarriesCodeAndLifetime() {
        JavaMailSender javaMailSender = mock(JavaMailSender.class);
        SmtpOtpMailSender sender = new SmtpOtpMailSender(javaMailSender, "no-reply@nestfind.app", Duration.ofMinutes(10));

        sender.sendOtp("new.tenant@nestfind.test", "904112");

        ArgumentCaptor<SimpleMailMessage> sent = ArgumentCaptor.forClass(SimpleMailMessage.class);
        verify(javaMailSender).send(sent.capture());
        assertThat(sent.getValue().getTo()).containsExactly("new.tenant@nestfind.test");
        assertThat(sent.getValue().getFrom()).isEqualTo("no-reply@nestfind.app");
        assertThat(sent.getValue().getText()).contains("904112").contains("10 minutes");
    }

    @Test
    void addressesAreMaskedForLogs() {
        assertThat(SmtpOtpMailSender.mask("alice@nestfind.test")).isEqualTo("a***@nestfind.test");
        assertThat(SmtpOtpMailSender.mask("a@nestfind.test")).isEqualTo("***@nestfind.test");
        assertThat(SmtpOtpMailSender.mask("no-at-sign")).isEqualTo("***");
    }
}
