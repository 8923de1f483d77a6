package com.nestfind.backend.modules.auth.application;

import java.util.Set;
import java.util.UUID;

import com.nestfind.backend.modules.auth.domain.NestUserStatus;

/**
 * Caller identity as read from the store on this request.
 */
public record AuthenticatedUser(
        UUID userId,
        UUID sessionId,
        String email,
        NestUserStatus status,
        Set<String> roles
) {

    public boolean isActive() {
        return status == NestUserStatus.ACTIVE;
    }

    public boolean hasRole(String roleCode) {
        return roles.contains(roleCode);
    }
}
