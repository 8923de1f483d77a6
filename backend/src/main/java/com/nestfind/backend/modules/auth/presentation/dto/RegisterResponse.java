package com.nestfind.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

public record RegisterResponse(String message, UUID userId, OffsetDateTime otpExpiresAt) {
}
