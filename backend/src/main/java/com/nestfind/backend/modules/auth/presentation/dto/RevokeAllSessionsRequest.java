package com.nestfind.backend.modules.auth.presentation.dto;

import java.util.UUID;

import jakarta.validation.constraints.NotNull;

public record RevokeAllSessionsRequest(@NotNull(message = "userId is required") UUID userId) {
}
