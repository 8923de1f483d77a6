package com.nestfind.backend.modules.auth.application;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Base64;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.nestfind.backend.modules.audit.application.AuditLogService;
import com.nestfind.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.nestfind.backend.modules.auth.domain.AuthFailure;
import com.nestfind.backend.modules.auth.domain.AuthResult;
import com.nestfind.backend.modules.auth.domain.NestUser;
import com.nestfind.backend.modules.auth.domain.NestUserStatus;
import com.nestfind.backend.modules.auth.domain.Role;
import com.nestfind.backend.modules.auth.domain.SessionRevokeReason;
import com.nestfind.backend.modules.auth.domain.SupersededRefreshToken;
import com.nestfind.backend.modules.auth.domain.UserSession;
import com.nestfind.backend.modules.auth.infrastructure.persistence.SupersededRefreshTokenRepository;
import com.nestfind.backend.modules.auth.infrastructure.persistence.UserRoleRepository;
import com.nestfind.backend.modules.auth.infrastructure.persistence.UserSessionRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Opaque refresh tokens bound to a session, rotated on every use.
 *
 * <p>The session row keeps the current head hash and its parent; every superseded hash is also
 * archived with its family. Presenting any superseded token is treated as theft: the whole family
 * is revoked, including the session holding the legitimate newest token.
 */
@Service
@Transactional
public class RefreshTokenRotator {

    private static final Logger log = LoggerFactory.getLogger(RefreshTokenRotator.class);
    private static final int TOKEN_BYTES = 64;

    private final UserSessionRepository userSessionRepository;
    private final SupersededRefreshTokenRepository supersededRefreshTokenRepository;
    private final UserRoleRepository userRoleRepository;
    private final SessionRegistry sessionRegistry;
    private final AuditLogService auditLogService;
    private final TokenHasher tokenHasher;
    private final AuthPolicyProperties policy;
    private final Clock clock;
    private final SecureRandom secureRandom = new SecureRandom();

    public RefreshTokenRotator(
            UserSessionRepository userSessionRepository,
            SupersededRefreshTokenRepository supersededRefreshTokenRepository,
            UserRoleRepository userRoleRepository,
            SessionRegistry sessionRegistry,
            AuditLogService auditLogService,
            TokenHasher tokenHasher,
            AuthPolicyProperties policy,
            Clock clock
    ) {
        this.userSessionRepository = userSessionRepository;
        this.supersededRefreshTokenRepository = supersededRefreshTokenRepository;
        this.userRoleRepository = userRoleRepository;
        this.sessionRegistry = sessionRegistry;
        this.auditLogService = auditLogService;
        this.tokenHasher = tokenHasher;
        this.policy = policy;
        this.clock = clock;
    }

    /**
     * Attaches the first refresh token of a freshly created session and stretches the session
     * to the refresh lifetime. The plaintext is returned once and never stored.
     */
    public IssuedRefreshToken issue(UUID sessionId) {
        UserSession session = userSessionRepository.findByIdForUpdate(sessionId)
                .orElseThrow(() -> new IllegalStateException("Session not found: " + sessionId));
        if (session.isRevoked()) {
            throw new IllegalStateException("Cannot issue a refresh token for revoked session " + sessionId);
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        String token = newToken();
        OffsetDateTime expiresAt = now.plus(refreshTtlFor(session.getUser().getId()));

        session.setRefreshTokenHash(tokenHasher.hash(token));
        session.setParentTokenHash(null);
        session.setExpiresAt(expiresAt);

        return new IssuedRefreshToken(token, expiresAt);
    }

    public AuthResult<RotatedRefreshToken> rotate(String presentedToken, String ip) {
        if (presentedToken == null || presentedToken.isBlank()) {
            return AuthResult.fail(AuthFailure.TOKEN_INVALID);
        }
        String presentedHash = tokenHasher.hash(presentedToken.trim());

        Optional<UserSession> head = userSessionRepository.findByRefreshTokenHashForUpdate(presentedHash);
        if (head.isPresent()) {
            return rotateHead(head.get(), presentedHash, ip);
        }

        Optional<UUID> replayedFamily = userSessionRepository.findFirstByParentTokenHash(presentedHash)
                .map(UserSession::getTokenFamilyId)
                .or(() -> supersededRefreshTokenRepository.findById(presentedHash)
                        .map(SupersededRefreshToken::getTokenFamilyId));
        if (replayedFamily.isPresent()) {
            UUID familyId = replayedFamily.get();
            int revoked = sessionRegistry.revokeFamily(familyId, SessionRevokeReason.REFRESH_REUSE_DETECTED, ip);
            auditLogService.record(new AuditLogCommand(
                    "TOKEN_REVOKED", "TOKEN_FAMILY", familyId.toString(), null, ip,
                    Map.of("reason", "refresh_token_reuse_detected", "sessionsRevoked", revoked)
            ));
            log.warn("Superseded refresh token replayed for family {}; {} session(s) revoked", familyId, revoked);
            return AuthResult.fail(AuthFailure.REFRESH_REUSE_DETECTED);
        }

        log.debug("Unknown refresh token presented");
        return AuthResult.fail(AuthFailure.TOKEN_INVALID);
    }

    private AuthResult<RotatedRefreshToken> rotateHead(UserSession session, String presentedHash, String ip) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        if (session.isRevoked()) {
            return AuthResult.fail(AuthFailure.SESSION_REVOKED);
        }
        if (session.isExpiredAt(now)) {
            return AuthResult.fail(AuthFailure.TOKEN_EXPIRED);
        }

        NestUser user = session.getUser();
        if (user.getStatus() == NestUserStatus.SUSPENDED) {
            sessionRegistry.revoke(session.getId(), SessionRevokeReason.USER_SUSPENDED, null, ip);
            return AuthResult.fail(AuthFailure.SESSION_REVOKED);
        }

        String token = newToken();
        OffsetDateTime expiresAt = now.plus(refreshTtlFor(user.getId()));

        supersededRefreshTokenRepository.save(new SupersededRefreshToken(
                presentedHash, session.getId(), session.getTokenFamilyId(), now));
        session.setParentTokenHash(presentedHash);
        session.setRefreshTokenHash(tokenHasher.hash(token));
        session.setExpiresAt(expiresAt);
        session.setLastIp(ip);

        auditLogService.record(AuditLogCommand.forSession(
                "TOKEN_REFRESHED", session.getId(), user.getId(), ip,
                Map.of("tokenFamilyId", session.getTokenFamilyId().toString())
        ));
        return AuthResult.ok(new RotatedRefreshToken(
                token, session.getId(), user.getId(), session.getTokenFamilyId(), expiresAt));
    }

    private Duration refreshTtlFor(UUID userId) {
        boolean admin = userRoleRepository.findActiveRoles(userId).stream()
                .anyMatch(userRole -> Role.ADMIN.equals(userRole.getRole().getCode()));
        return admin ? policy.adminRefreshTokenTtl() : policy.refreshTokenTtl();
    }

    private String newToken() {
        byte[] bytes = new byte[TOKEN_BYTES];
        secureRandom.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    public record IssuedRefreshToken(String token, OffsetDateTime expiresAt) {
    }

    public record RotatedRefreshToken(
            String token,
            UUID sessionId,
            UUID userId,
            UUID tokenFamilyId,
            OffsetDateTime expiresAt
    ) {
    }
}
