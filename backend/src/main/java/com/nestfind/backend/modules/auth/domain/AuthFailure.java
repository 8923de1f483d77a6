package com.nestfind.backend.modules.auth.domain;

/**
 * Closed set of expected authentication outcomes other than success.
 */
public enum AuthFailure {
    INVALID_CREDENTIAL,
    ACCOUNT_LOCKED,
    TOKEN_EXPIRED,
    TOKEN_INVALID,
    SESSION_REVOKED,
    OTP_NOT_FOUND,
    OTP_EXPIRED,
    OTP_INVALID,
    OTP_REUSE_BLOCKED,
    REFRESH_REUSE_DETECTED
}
