package com.nestfind.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record LoginResponse(
        boolean success,
        String message,
        TokenPairResponse tokens,
        UserProfileResponse user,
        OffsetDateTime lockedUntil
) {

    public static LoginResponse success(TokenPairResponse tokens, UserProfileResponse user) {
        return new LoginResponse(true, "Login successful", tokens, user, null);
    }

    public static LoginResponse failure(String message, OffsetDateTime lockedUntil) {
        return new LoginResponse(false, message, null, null, lockedUntil);
    }
}
