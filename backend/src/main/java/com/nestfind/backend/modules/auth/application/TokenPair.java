package com.nestfind.backend.modules.auth.application;

import java.time.OffsetDateTime;
import java.util.UUID;

public record TokenPair(
        UUID userId,
        UUID sessionId,
        String accessToken,
        OffsetDateTime issuedAt,
        OffsetDateTime accessTokenExpiresAt,
        String refreshToken,
        OffsetDateTime refreshTokenExpiresAt
) {
}
