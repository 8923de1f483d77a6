package com.nestfind.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

public record OtpGenerateResponse(UUID otpId, OffsetDateTime expiresAt, String message) {
}
