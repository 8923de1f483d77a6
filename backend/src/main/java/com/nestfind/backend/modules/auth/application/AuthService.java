package com.nestfind.backend.modules.auth.application;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import com.nestfind.backend.global.error.ProblemException;
import com.nestfind.backend.modules.audit.application.AuditLogService;
import com.nestfind.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.nestfind.backend.modules.auth.application.AccessTokenIssuer.IssuedAccessToken;
import com.nestfind.backend.modules.auth.application.RefreshTokenRotator.IssuedRefreshToken;
import com.nestfind.backend.modules.auth.application.RefreshTokenRotator.RotatedRefreshToken;
import com.nestfind.backend.modules.auth.domain.AuthFailure;
import com.nestfind.backend.modules.auth.domain.AuthResult;
import com.nestfind.backend.modules.auth.domain.NestUser;
import com.nestfind.backend.modules.auth.domain.Role;
import com.nestfind.backend.modules.auth.domain.SessionRevokeReason;
import com.nestfind.backend.modules.auth.infrastructure.persistence.NestUserRepository;
import com.nestfind.backend.modules.auth.presentation.dto.UserProfileResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Login, refresh and logout flows on top of the individual authentication components.
 * Expected failures come back as {@link AuthResult}s so that counters and revocations written
 * on the failing path still commit.
 */
@Service
@Transactional
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    public static final String ADMIN_PORTAL = "admin";

    private final PasswordAuthenticator passwordAuthenticator;
    private final SessionRegistry sessionRegistry;
    private final AccessTokenIssuer accessTokenIssuer;
    private final RefreshTokenRotator refreshTokenRotator;
    private final AccessControlGate accessControlGate;
    private final NestUserRepository nestUserRepository;
    private final AuditLogService auditLogService;

    public AuthService(
            PasswordAuthenticator passwordAuthenticator,
            SessionRegistry sessionRegistry,
            AccessTokenIssuer accessTokenIssuer,
            RefreshTokenRotator refreshTokenRotator,
            AccessControlGate accessControlGate,
            NestUserRepository nestUserRepository,
            AuditLogService auditLogService
    ) {
        this.passwordAuthenticator = passwordAuthenticator;
        this.sessionRegistry = sessionRegistry;
        this.accessTokenIssuer = accessTokenIssuer;
        this.refreshTokenRotator = refreshTokenRotator;
        this.accessControlGate = accessControlGate;
        this.nestUserRepository = nestUserRepository;
        this.auditLogService = auditLogService;
    }

    /**
     * Password login. The admin portal additionally requires an active ADMIN grant; a user
     * without one gets the same generic failure as a wrong password and no session.
     */
    public AuthResult<TokenPair> login(String email, String password, String portal, String ip, String userAgent) {
        AuthResult<UUID> authenticated = passwordAuthenticator.authenticate(email, password, ip);
        if (!authenticated.success()) {
            return authenticated.propagate();
        }
        UUID userId = authenticated.value();

        if (ADMIN_PORTAL.equalsIgnoreCase(portal)
                && !accessControlGate.activeRoleCodes(userId).contains(Role.ADMIN)) {
            auditLogService.record(AuditLogCommand.forUser(
                    "LOGIN_PORTAL_DENIED", userId, ip, Map.of("portal", ADMIN_PORTAL)));
            log.info("User {} denied access to the admin portal", userId);
            return AuthResult.fail(AuthFailure.INVALID_CREDENTIAL);
        }

        UUID sessionId = sessionRegistry.create(userId, ip, userAgent);
        IssuedRefreshToken refreshToken = refreshTokenRotator.issue(sessionId);
        IssuedAccessToken accessToken = accessTokenIssuer.issue(userId, sessionId);
        return AuthResult.ok(new TokenPair(
                userId,
                sessionId,
                accessToken.token(),
                accessToken.issuedAt(),
                accessToken.expiresAt(),
                refreshToken.token(),
                refreshToken.expiresAt()
        ));
    }

    public AuthResult<TokenPair> refresh(String refreshToken, String ip) {
        AuthResult<RotatedRefreshToken> rotated = refreshTokenRotator.rotate(refreshToken, ip);
        if (!rotated.success()) {
            log.info("Refresh rejected: {}", rotated.failure());
            return rotated.propagate();
        }
        RotatedRefreshToken next = rotated.value();
        IssuedAccessToken accessToken = accessTokenIssuer.issue(next.userId(), next.sessionId());
        return AuthResult.ok(new TokenPair(
                next.userId(),
                next.sessionId(),
                accessToken.token(),
                accessToken.issuedAt(),
                accessToken.expiresAt(),
                next.token(),
                next.expiresAt()
        ));
    }

    public void logout(UUID sessionId, UUID userId, String ip) {
        boolean revoked = sessionRegistry.revoke(sessionId, SessionRevokeReason.LOGOUT, userId, ip);
        auditLogService.record(AuditLogCommand.forUser(
                "LOGOUT", userId, ip, Map.of("sessionId", sessionId.toString(), "revoked", revoked)));
    }

    public int revokeAllSessions(UUID targetUserId, UUID actorUserId, String ip) {
        if (!nestUserRepository.existsById(targetUserId)) {
            throw new ProblemException(HttpStatus.NOT_FOUND, "USER_NOT_FOUND", "User not found");
        }
        return sessionRegistry.revokeAllForUser(targetUserId, actorUserId, ip);
    }

    @Transactional(readOnly = true)
    public UserProfileResponse loadProfile(UUID userId) {
        NestUser user = nestUserRepository.findById(userId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "USER_NOT_FOUND", "User not found"));
        Set<String> roles = accessControlGate.activeRoleCodes(userId);
        return new UserProfileResponse(
                user.getId(),
                user.getEmail(),
                user.getFullName(),
                user.getMobileNumber(),
                user.getStatus().name(),
                List.copyOf(roles),
                roles.contains(Role.ADMIN),
                user.getEmailVerifiedAt(),
                user.getCreatedAt()
        );
    }
}
