package com.nestfind.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record OtpVerifyResponse(
        boolean success,
        String message,
        String code,
        String status,
        Integer attemptsRemaining,
        OffsetDateTime lockedUntil
) {
}
