package com.nestfind.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

public record TokenPairResponse(
        String accessToken,
        String tokenType,
        long expiresIn,
        String refreshToken,
        long refreshExpiresIn,
        OffsetDateTime issuedAt,
        UUID sessionId
) {
    public static final String DEFAULT_TOKEN_TYPE = "Bearer";
}
