package com.nestfind.backend.modules.auth.domain;

public enum NestUserStatus {
    PENDING_VERIFICATION,
    ACTIVE,
    IN_REVIEW,
    DECLINED,
    SUSPENDED
}
