package com.nestfind.backend.modules.auth.presentation;

import java.time.Duration;

import com.nestfind.backend.global.error.ProblemResponse;
import com.nestfind.backend.global.web.RequestTraceFilter;
import com.nestfind.backend.modules.auth.application.AuthService;
import com.nestfind.backend.modules.auth.application.AuthenticatedUser;
import com.nestfind.backend.modules.auth.application.TokenPair;
import com.nestfind.backend.modules.auth.domain.AuthFailure;
import com.nestfind.backend.modules.auth.domain.AuthResult;
import com.nestfind.backend.modules.auth.presentation.dto.LoginRequest;
import com.nestfind.backend.modules.auth.presentation.dto.LoginResponse;
import com.nestfind.backend.modules.auth.presentation.dto.RefreshRequest;
import com.nestfind.backend.modules.auth.presentation.dto.TokenPairResponse;
import com.nestfind.backend.modules.auth.presentation.dto.UserProfileResponse;

import io.swagger.v3.oas.annotations.Operation;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AuthController {

    static final String INVALID_CREDENTIALS_MESSAGE = "Invalid credentials";
    static final String LOCKED_MESSAGE = "Account temporarily locked";

    private final AuthService authService;
    private final AuthCookies authCookies;

    public AuthController(AuthService authService, AuthCookies authCookies) {
        this.authService = authService;
        this.authCookies = authCookies;
    }

    @Operation(summary = "Email and password login")
    @PostMapping("/auth/login")
    public ResponseEntity<LoginResponse> login(
            @Valid @RequestBody LoginRequest request,
            HttpServletRequest httpRequest,
            HttpServletResponse httpResponse
    ) {
        AuthResult<TokenPair> result = authService.login(
                request.email(),
                request.password(),
                request.portal(),
                RequestTraceFilter.clientIp(httpRequest),
                httpRequest.getHeader(HttpHeaders.USER_AGENT)
        );
        if (!result.success()) {
            if (result.failedWith(AuthFailure.ACCOUNT_LOCKED)) {
                return ResponseEntity.status(HttpStatus.LOCKED)
                        .body(LoginResponse.failure(LOCKED_MESSAGE, result.lockedUntil()));
            }
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                    .body(LoginResponse.failure(INVALID_CREDENTIALS_MESSAGE, null));
        }

        TokenPair tokens = result.value();
        authCookies.write(httpResponse, tokens);
        UserProfileResponse profile = authService.loadProfile(tokens.userId());
        return ResponseEntity.ok(LoginResponse.success(toResponse(tokens), profile));
    }

    @Operation(summary = "Rotate the refresh token and issue a new access token")
    @PostMapping("/auth/refresh")
    public ResponseEntity<?> refresh(
            @RequestBody(required = false) RefreshRequest request,
            HttpServletRequest httpRequest,
            HttpServletResponse httpResponse
    ) {
        // an explicit body token wins over a possibly stale cookie
        String presented = request != null && StringUtils.hasText(request.refreshToken())
                ? request.refreshToken()
                : authCookies.readRefreshToken(httpRequest);

        AuthResult<TokenPair> result = authService.refresh(presented, RequestTraceFilter.clientIp(httpRequest));
        if (!result.success()) {
            authCookies.clear(httpResponse);
            ProblemResponse body = ProblemResponse.of(
                    HttpStatus.UNAUTHORIZED,
                    result.failure().name(),
                    "Refresh token rejected",
                    httpRequest.getRequestURI()
            );
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                    .contentType(MediaType.APPLICATION_PROBLEM_JSON)
                    .body(body);
        }

        authCookies.write(httpResponse, result.value());
        return ResponseEntity.ok(toResponse(result.value()));
    }

    @Operation(summary = "Revoke the current session")
    @PostMapping("/auth/logout")
    public ResponseEntity<Void> logout(
            @AuthenticationPrincipal AuthenticatedUser principal,
            HttpServletRequest httpRequest,
            HttpServletResponse httpResponse
    ) {
        authService.logout(principal.sessionId(), principal.userId(), RequestTraceFilter.clientIp(httpRequest));
        authCookies.clear(httpResponse);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Current user's profile as stored")
    @GetMapping("/auth/me")
    public ResponseEntity<UserProfileResponse> currentUser(@AuthenticationPrincipal AuthenticatedUser principal) {
        return ResponseEntity.ok(authService.loadProfile(principal.userId()));
    }

    private static TokenPairResponse toResponse(TokenPair tokens) {
        return new TokenPairResponse(
                tokens.accessToken(),
                TokenPairResponse.DEFAULT_TOKEN_TYPE,
                Duration.between(tokens.issuedAt(), tokens.accessTokenExpiresAt()).toSeconds(),
                tokens.refreshToken(),
                Duration.between(tokens.issuedAt(), tokens.refreshTokenExpiresAt()).toSeconds(),
                tokens.issuedAt(),
                tokens.sessionId()
        );
    }
}
