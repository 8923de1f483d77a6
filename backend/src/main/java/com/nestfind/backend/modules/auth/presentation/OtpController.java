package com.nestfind.backend.modules.auth.presentation;

import com.nestfind.backend.global.web.RequestTraceFilter;
import com.nestfind.backend.modules.auth.application.OtpVerifier;
import com.nestfind.backend.modules.auth.application.OtpVerifier.IssuedOtp;
import com.nestfind.backend.modules.auth.domain.AuthFailure;
import com.nestfind.backend.modules.auth.domain.AuthResult;
import com.nestfind.backend.modules.auth.domain.NestUserStatus;
import com.nestfind.backend.modules.auth.presentation.dto.OtpGenerateRequest;
import com.nestfind.backend.modules.auth.presentation.dto.OtpGenerateResponse;
import com.nestfind.backend.modules.auth.presentation.dto.OtpVerifyRequest;
import com.nestfind.backend.modules.auth.presentation.dto.OtpVerifyResponse;

import io.swagger.v3.oas.annotations.Operation;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class OtpController {

    private final OtpVerifier otpVerifier;

    public OtpController(OtpVerifier otpVerifier) {
        this.otpVerifier = otpVerifier;
    }

    @Operation(summary = "Send a new email verification code")
    @PostMapping("/auth/otp/generate")
    public ResponseEntity<OtpGenerateResponse> generate(
            @Valid @RequestBody OtpGenerateRequest request,
            HttpServletRequest httpRequest
    ) {
        IssuedOtp issued = otpVerifier.generateAndStore(request.userId(), RequestTraceFilter.clientIp(httpRequest));
        String message = issued.delivered()
                ? "Verification code sent"
                : "Verification code created but email delivery failed";
        return ResponseEntity.ok(new OtpGenerateResponse(issued.otpId(), issued.expiresAt(), message));
    }

    @Operation(summary = "Verify an email verification code")
    @PostMapping("/auth/otp/verify")
    public ResponseEntity<OtpVerifyResponse> verify(
            @Valid @RequestBody OtpVerifyRequest request,
            HttpServletRequest httpRequest
    ) {
        AuthResult<NestUserStatus> result = otpVerifier.verify(
                request.userId(), request.otp(), RequestTraceFilter.clientIp(httpRequest));
        if (result.success()) {
            return ResponseEntity.ok(new OtpVerifyResponse(
                    true, "Email verified", null, result.value().name(), null, null));
        }

        HttpStatus status = result.failedWith(AuthFailure.ACCOUNT_LOCKED) ? HttpStatus.LOCKED : HttpStatus.BAD_REQUEST;
        return ResponseEntity.status(status).body(new OtpVerifyResponse(
                false,
                messageFor(result.failure()),
                result.failure().name(),
                null,
                result.attemptsRemaining(),
                result.lockedUntil()
        ));
    }

    private static String messageFor(AuthFailure failure) {
        return switch (failure) {
            case ACCOUNT_LOCKED -> "Account temporarily locked";
            case OTP_EXPIRED -> "Verification code expired";
            case OTP_INVALID -> "Invalid verification code";
            case OTP_REUSE_BLOCKED -> "Verification code already used";
            default -> "No active verification code";
        };
    }
}
