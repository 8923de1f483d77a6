package com.nestfind.backend.modules.auth.presentation.dto;

import java.util.UUID;

import jakarta.validation.constraints.NotNull;

public record OtpGenerateRequest(@NotNull(message = "userId is required") UUID userId) {
}
