package com.nestfind.backend.modules.auth.presentation.dto;

public record RevokeAllSessionsResponse(boolean success, int sessionsRevoked) {
}
