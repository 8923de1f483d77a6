package com.nestfind.backend.modules.auth.domain;

public enum SessionRevokeReason {
    LOGOUT,
    REFRESH_REUSE_DETECTED,
    ADMIN_REVOKE_ALL,
    USER_SUSPENDED
}
