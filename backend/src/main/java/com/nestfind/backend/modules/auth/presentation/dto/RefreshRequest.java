package com.nestfind.backend.modules.auth.presentation.dto;

/**
 * Body is optional when the refresh_token cookie is present.
 */
public record RefreshRequest(String refreshToken) {
}
