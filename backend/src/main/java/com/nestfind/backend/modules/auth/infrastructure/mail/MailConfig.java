package com.nestfind.backend.modules.auth.infrastructure.mail;

import com.nestfind.backend.modules.auth.application.AuthPolicyProperties;
import com.nestfind.backend.modules.auth.application.OtpMailSender;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.mail.javamail.JavaMailSender;

@Configuration
public class MailConfig {

    @Bean
    public OtpMailSender otpMailSender(
            @Value("${app.mail.enabled:false}") boolean mailEnabled,
            @Value("${app.mail.from:no-reply@nestfind.app}") String from,
            ObjectProvider<JavaMailSender> javaMailSender,
            AuthPolicyProperties policy
    ) {
        if (!mailEnabled) {
            return new DisabledOtpMailSender();
        }
        JavaMailSender sender = javaMailSender.getIfAvailable();
        if (sender == null) {
            throw new IllegalStateException("app.mail.enabled=true requires spring.mail.host to be configured");
        }
        return new SmtpOtpMailSender(sender, from, policy.otpTtl());
    }
}
