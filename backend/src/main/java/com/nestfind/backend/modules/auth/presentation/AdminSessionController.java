package com.nestfind.backend.modules.auth.presentation;

import com.nestfind.backend.global.web.RequestTraceFilter;
import com.nestfind.backend.modules.auth.application.AccessControlGate;
import com.nestfind.backend.modules.auth.application.AuthService;
import com.nestfind.backend.modules.auth.application.AuthenticatedUser;
import com.nestfind.backend.modules.auth.domain.Role;
import com.nestfind.backend.modules.auth.presentation.dto.RevokeAllSessionsRequest;
import com.nestfind.backend.modules.auth.presentation.dto.RevokeAllSessionsResponse;

import io.swagger.v3.oas.annotations.Operation;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AdminSessionController {

    private final AuthService authService;
    private final AccessControlGate accessControlGate;

    public AdminSessionController(AuthService authService, AccessControlGate accessControlGate) {
        this.authService = authService;
        this.accessControlGate = accessControlGate;
    }

    @Operation(summary = "Revoke every session of a user")
    @PostMapping("/auth/admin/revoke-all-sessions")
    public ResponseEntity<RevokeAllSessionsResponse> revokeAllSessions(
            @AuthenticationPrincipal AuthenticatedUser principal,
            @Valid @RequestBody RevokeAllSessionsRequest request,
            HttpServletRequest httpRequest
    ) {
        accessControlGate.requireRole(principal, Role.ADMIN);
        int revoked = authService.revokeAllSessions(
                request.userId(), principal.userId(), RequestTraceFilter.clientIp(httpRequest));
        return ResponseEntity.ok(new RevokeAllSessionsResponse(true, revoked));
    }
}
