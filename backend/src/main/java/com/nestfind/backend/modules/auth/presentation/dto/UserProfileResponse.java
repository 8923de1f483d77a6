package com.nestfind.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public record UserProfileResponse(
        UUID userId,
        String email,
        String fullName,
        String mobileNumber,
        String status,
        List<String> roles,
        boolean isAdmin,
        OffsetDateTime emailVerifiedAt,
        OffsetDateTime createdAt
) {
}
