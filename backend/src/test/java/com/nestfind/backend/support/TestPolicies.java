package com.nestfind.backend.support;

import java.time.Duration;

import com.nestfind.backend.modules.auth.application.AuthPolicyProperties;

public final class TestPolicies {

    public static final String HASH_SECRET = "unit-test-token-hash-secret-0123456789";

    private TestPolicies() {
    }

    public static AuthPolicyProperties defaults() {
        return new AuthPolicyProperties(
                5,
                Duration.ofMinutes(15),
                6,
                Duration.ofMinutes(10),
                3,
                Duration.ofMinutes(30),
                Duration.ofMinutes(15),
                Duration.ofDays(7),
                Duration.ofHours(1),
                HASH_SECRET
        );
    }
}
