package com.nestfind.backend.modules.auth.application;

import java.time.Duration;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Lockout, OTP and session lifetimes. Kept in configuration so operators can tighten them
 * without a release.
 */
@Validated
@ConfigurationProperties(prefix = "app.auth")
public record AuthPolicyProperties(
        @DefaultValue("5") @Min(1) int maxLoginAttempts,
        @DefaultValue("15m") @NotNull Duration loginLockout,
        @DefaultValue("6") @Min(4) @Max(10) int otpLength,
        @DefaultValue("10m") @NotNull Duration otpTtl,
        @DefaultValue("3") @Min(1) int otpMaxAttempts,
        @DefaultValue("30m") @NotNull Duration otpLockout,
        @DefaultValue("15m") @NotNull Duration sessionTtl,
        @DefaultValue("7d") @NotNull Duration refreshTokenTtl,
        @DefaultValue("1h") @NotNull Duration adminRefreshTokenTtl,
        @NotBlank @Size(min = 32) String tokenHashSecret
) {
}
