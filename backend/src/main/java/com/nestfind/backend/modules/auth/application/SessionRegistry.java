package com.nestfind.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import com.nestfind.backend.modules.audit.application.AuditLogService;
import com.nestfind.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.nestfind.backend.modules.auth.domain.AuthFailure;
import com.nestfind.backend.modules.auth.domain.AuthResult;
import com.nestfind.backend.modules.auth.domain.NestUser;
import com.nestfind.backend.modules.auth.domain.SessionRevokeReason;
import com.nestfind.backend.modules.auth.domain.UserSession;
import com.nestfind.backend.modules.auth.infrastructure.persistence.NestUserRepository;
import com.nestfind.backend.modules.auth.infrastructure.persistence.UserSessionRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Owns the lifecycle of server-side sessions: creation at login, validity checks on every
 * request, and revocation (single, per user, per token family). Revocation is permanent.
 */
@Service
@Transactional
public class SessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    private final UserSessionRepository userSessionRepository;
    private final NestUserRepository nestUserRepository;
    private final AuditLogService auditLogService;
    private final UserEventNotifier userEventNotifier;
    private final TokenHasher tokenHasher;
    private final AuthPolicyProperties policy;
    private final Clock clock;

    public SessionRegistry(
            UserSessionRepository userSessionRepository,
            NestUserRepository nestUserRepository,
            AuditLogService auditLogService,
            UserEventNotifier userEventNotifier,
            TokenHasher tokenHasher,
            AuthPolicyProperties policy,
            Clock clock
    ) {
        this.userSessionRepository = userSessionRepository;
        this.nestUserRepository = nestUserRepository;
        this.auditLogService = auditLogService;
        this.userEventNotifier = userEventNotifier;
        this.tokenHasher = tokenHasher;
        this.policy = policy;
        this.clock = clock;
    }

    /**
     * Opens a session in a fresh token family. It has no refresh token yet and a short expiry
     * until one is attached.
     */
    public UUID create(UUID userId, String ip, String userAgent) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        NestUser user = nestUserRepository.getReferenceById(userId);

        UserSession session = new UserSession();
        session.setUser(user);
        session.setTokenFamilyId(UUID.randomUUID());
        session.setIssuedAt(now);
        session.setExpiresAt(now.plus(policy.sessionTtl()));
        session.setLastIp(ip);
        if (userAgent != null && !userAgent.isBlank()) {
            session.setDeviceFingerprint(tokenHasher.hash(userAgent));
        }
        UserSession saved = userSessionRepository.save(session);

        auditLogService.record(AuditLogCommand.forSession(
                "SESSION_CREATED", saved.getId(), userId, ip,
                Map.of("tokenFamilyId", saved.getTokenFamilyId().toString())
        ));
        log.info("Session {} created for user {}", saved.getId(), userId);
        return saved.getId();
    }

    @Transactional(readOnly = true)
    public AuthResult<ActiveSession> verify(UUID sessionId) {
        if (sessionId == null) {
            return AuthResult.fail(AuthFailure.SESSION_REVOKED);
        }
        Optional<UserSession> found = userSessionRepository.findWithUserById(sessionId);
        if (found.isEmpty()) {
            return AuthResult.fail(AuthFailure.SESSION_REVOKED);
        }
        UserSession session = found.get();
        if (session.isRevoked() || session.isExpiredAt(OffsetDateTime.now(clock))) {
            return AuthResult.fail(AuthFailure.SESSION_REVOKED);
        }
        return AuthResult.ok(ActiveSession.of(session));
    }

    /**
     * Idempotent. Returns true only when this call did the revoking.
     */
    public boolean revoke(UUID sessionId, SessionRevokeReason reason, UUID actorUserId, String ip) {
        Optional<UserSession> found = userSessionRepository.findByIdForUpdate(sessionId);
        if (found.isEmpty()) {
            return false;
        }
        UserSession session = found.get();
        if (!revokeLocked(session, reason, actorUserId, ip)) {
            return false;
        }
        notifyAfterCommit(session.getUser().getId(), UserEventNotifier.SESSION_REVOKED);
        return true;
    }

    /**
     * Logout-everywhere. Every unrevoked session of the user is revoked in this transaction.
     */
    public int revokeAllForUser(UUID userId, UUID actorUserId, String ip) {
        List<UserSession> sessions = userSessionRepository.findUnrevokedByUserIdForUpdate(userId);
        int revoked = 0;
        for (UserSession session : sessions) {
            if (revokeLocked(session, SessionRevokeReason.ADMIN_REVOKE_ALL, actorUserId, ip)) {
                revoked++;
            }
        }
        auditLogService.record(AuditLogCommand.forUser(
                "SESSIONS_REVOKED_ALL", userId, ip,
                Map.of("sessionsRevoked", revoked, "actorUserId", String.valueOf(actorUserId))
        ));
        log.info("Revoked {} session(s) of user {} on request of {}", revoked, userId, actorUserId);
        notifyAfterCommit(userId, UserEventNotifier.SESSIONS_REVOKED_ALL);
        return revoked;
    }

    /**
     * Revokes every session sharing the token family. Used when a superseded refresh token is replayed.
     */
    public int revokeFamily(UUID tokenFamilyId, SessionRevokeReason reason, String ip) {
        List<UserSession> sessions = userSessionRepository.findUnrevokedByFamilyForUpdate(tokenFamilyId);
        Set<UUID> owners = new LinkedHashSet<>();
        int revoked = 0;
        for (UserSession session : sessions) {
            if (revokeLocked(session, reason, null, ip)) {
                revoked++;
                owners.add(session.getUser().getId());
            }
        }
        log.warn("Token family {} revoked ({} session(s)), reason {}", tokenFamilyId, revoked, reason);
        owners.forEach(owner -> notifyAfterCommit(owner, UserEventNotifier.TOKEN_REUSE_DETECTED));
        return revoked;
    }

    private boolean revokeLocked(UserSession session, SessionRevokeReason reason, UUID actorUserId, String ip) {
        if (!session.revoke(OffsetDateTime.now(clock), reason.name())) {
            return false;
        }
        auditLogService.record(AuditLogCommand.forSession(
                "SESSION_REVOKED", session.getId(), actorUserId, ip,
                Map.of(
                        "reason", reason.name(),
                        "userId", session.getUser().getId().toString(),
                        "tokenFamilyId", session.getTokenFamilyId().toString()
                )
        ));
        return true;
    }

    private void notifyAfterCommit(UUID userId, String event) {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    userEventNotifier.notify(userId, event);
                }
            });
        } else {
            userEventNotifier.notify(userId, event);
        }
    }

    public record ActiveSession(UUID sessionId, UUID userId, UUID tokenFamilyId, OffsetDateTime expiresAt) {

        static ActiveSession of(UserSession session) {
            return new ActiveSession(
                    session.getId(),
                    session.getUser().getId(),
                    session.getTokenFamilyId(),
                    session.getExpiresAt()
            );
        }
    }
}
