package com.nestfind.backend.modules.auth.domain;

import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * Outcome of an authentication operation: either a value, or one {@link AuthFailure}
 * with the lock timestamp or remaining attempts where those apply.
 */
public record AuthResult<T>(
        boolean success,
        T value,
        AuthFailure failure,
        OffsetDateTime lockedUntil,
        Integer attemptsRemaining
) {

    public AuthResult {
        if (success && failure != null) {
            throw new IllegalArgumentException("successful result cannot carry a failure");
        }
        if (!success && failure == null) {
            throw new IllegalArgumentException("failed result requires a failure kind");
        }
    }

    public static <T> AuthResult<T> ok(T value) {
        return new AuthResult<>(true, value, null, null, null);
    }

    public static <T> AuthResult<T> fail(AuthFailure failure) {
        return new AuthResult<>(false, null, Objects.requireNonNull(failure), null, null);
    }

    public static <T> AuthResult<T> locked(OffsetDateTime until) {
        return new AuthResult<>(false, null, AuthFailure.ACCOUNT_LOCKED, until, null);
    }

    public static <T> AuthResult<T> otpInvalid(int attemptsRemaining) {
        return new AuthResult<>(false, null, AuthFailure.OTP_INVALID, null, attemptsRemaining);
    }

    public boolean failedWith(AuthFailure kind) {
        return !success && failure == kind;
    }

    /**
     * Re-types a failed result, keeping its failure details.
     */
    public <R> AuthResult<R> propagate() {
        if (success) {
            throw new IllegalStateException("cannot propagate a successful result");
        }
        return new AuthResult<>(false, null, failure, lockedUntil, attemptsRemaining);
    }
}
