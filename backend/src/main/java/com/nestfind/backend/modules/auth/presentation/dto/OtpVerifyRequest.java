package com.nestfind.backend.modules.auth.presentation.dto;

import java.util.UUID;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

public record OtpVerifyRequest(
        @NotNull(message = "userId is required") UUID userId,
        @NotBlank(message = "otp is required") @Pattern(regexp = "\\d{4,10}", message = "otp must be numeric") String otp
) {
}
