package com.nestfind.backend.global.config;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Refuses to finish startup when signing or hashing secrets are missing or weak.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final int MIN_SECRET_BYTES = 32;
    static final String PLACEHOLDER_SECRET = "change-me-in-production-nestfind-jwt-secret";

    private static final String[] REQUIRED_PROPERTIES = {
            "spring.datasource.url",
            "jwt.secret",
            "jwt.expiration",
            "app.auth.token-hash-secret"
    };

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = new ArrayList<>();

        for (String property : REQUIRED_PROPERTIES) {
            String value = environment.getProperty(property);
            if (value == null || value.isBlank()) {
                problems.add(property + ": missing");
            }
        }

        checkSecret("jwt.secret", problems);
        checkSecret("app.auth.token-hash-secret", problems);

        Optional.ofNullable(environment.getProperty("jwt.expiration")).ifPresent(raw -> {
            try {
                long expiration = Long.parseLong(raw.trim());
                if (expiration < 60_000 || expiration > 3_600_000) {
                    problems.add("jwt.expiration: must be between 60000 and 3600000 milliseconds");
                }
            } catch (NumberFormatException e) {
                problems.add("jwt.expiration: must be numeric");
            }
        });

        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Configuration check failed: {}", problem));
            throw new IllegalStateException("Invalid configuration: " + String.join(", ", problems));
        }
        log.info("Configuration check passed");
    }

    private void checkSecret(String property, List<String> problems) {
        String secret = environment.getProperty(property);
        if (secret == null || secret.isBlank()) {
            return;
        }
        if (PLACEHOLDER_SECRET.equals(secret)) {
            problems.add(property + ": replace the placeholder value with a random secret");
        }
        if (secret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
            problems.add(property + ": must be at least " + MIN_SECRET_BYTES + " bytes");
        }
    }
}
