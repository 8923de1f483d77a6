package com.nestfind.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.nestfind.backend.modules.audit.application.AuditLogService;
import com.nestfind.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.nestfind.backend.modules.auth.domain.AuthFailure;
import com.nestfind.backend.modules.auth.domain.AuthResult;
import com.nestfind.backend.modules.auth.domain.NestUser;
import com.nestfind.backend.modules.auth.domain.NestUserStatus;
import com.nestfind.backend.modules.auth.infrastructure.persistence.NestUserRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Email and password check with brute-force lockout.
 *
 * <p>The user row stays locked for the whole check so concurrent failures cannot both read the
 * same attempt count. Unknown identities, wrong passwords and suspended accounts all produce the
 * same {@link AuthFailure#INVALID_CREDENTIAL}; only an active lock is reported distinctly, and
 * then only with its expiry.
 */
@Service
@Transactional
public class PasswordAuthenticator {

    private static final Logger log = LoggerFactory.getLogger(PasswordAuthenticator.class);
    private static final int MAX_AUDIT_KEY_LENGTH = 128;

    private final NestUserRepository nestUserRepository;
    private final PasswordEncoder passwordEncoder;
    private final AuditLogService auditLogService;
    private final AuthPolicyProperties policy;
    private final Clock clock;
    private final String timingEqualiserHash;

    public PasswordAuthenticator(
            NestUserRepository nestUserRepository,
            PasswordEncoder passwordEncoder,
            AuditLogService auditLogService,
            AuthPolicyProperties policy,
            Clock clock
    ) {
        this.nestUserRepository = nestUserRepository;
        this.passwordEncoder = passwordEncoder;
        this.auditLogService = auditLogService;
        this.policy = policy;
        this.clock = clock;
        this.timingEqualiserHash = passwordEncoder.encode(UUID.randomUUID().toString());
    }

    public AuthResult<UUID> authenticate(String email, String password, String ip) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        String identifier = normalize(email);
        String rawPassword = password == null ? "" : password;

        Optional<NestUser> found = nestUserRepository.findByEmailForUpdate(identifier);
        if (found.isEmpty()) {
            // same hashing cost as a real account
            passwordEncoder.matches(rawPassword, timingEqualiserHash);
            auditLogService.record(new AuditLogCommand(
                    "LOGIN_FAILED", "LOGIN", truncate(identifier), null, ip,
                    Map.of("reason", "unknown_identity")
            ));
            log.info("Login failed for unknown identity");
            return AuthResult.fail(AuthFailure.INVALID_CREDENTIAL);
        }

        NestUser user = found.get();
        user.releaseElapsedLock(now);

        if (user.isLockedAt(now)) {
            audit("LOGIN_BLOCKED", user, ip, Map.of(
                    "reason", "account_locked",
                    "lockedUntil", user.getLoginLockedUntil().toString()
            ));
            log.info("Login refused for locked user {} (until {})", user.getId(), user.getLoginLockedUntil());
            return AuthResult.locked(user.getLoginLockedUntil());
        }

        if (user.getStatus() == NestUserStatus.SUSPENDED) {
            passwordEncoder.matches(rawPassword, timingEqualiserHash);
            audit("LOGIN_BLOCKED", user, ip, Map.of("reason", "account_suspended"));
            log.info("Login refused for suspended user {}", user.getId());
            return AuthResult.fail(AuthFailure.INVALID_CREDENTIAL);
        }

        if (!passwordEncoder.matches(rawPassword, user.getPasswordHash())) {
            return recordFailure(user, now, ip);
        }

        user.setLoginAttempts(0);
        user.setLoginLockedUntil(null);
        audit("LOGIN_SUCCESS", user, ip, Map.of("status", user.getStatus().name()));
        log.info("User {} authenticated", user.getId());
        return AuthResult.ok(user.getId());
    }

    private AuthResult<UUID> recordFailure(NestUser user, OffsetDateTime now, String ip) {
        int attempts = user.getLoginAttempts() + 1;
        user.setLoginAttempts(attempts);

        if (attempts >= policy.maxLoginAttempts()) {
            OffsetDateTime until = now.plus(policy.loginLockout());
            user.setLoginLockedUntil(until);
            audit("LOGIN_BLOCKED", user, ip, Map.of(
                    "reason", "max_login_attempts",
                    "attempts", attempts,
                    "lockedUntil", until.toString()
            ));
            log.warn("User {} locked until {} after {} failed logins", user.getId(), until, attempts);
            return AuthResult.locked(until);
        }

        audit("LOGIN_FAILED", user, ip, Map.of(
                "reason", "invalid_password",
                "attempts", attempts,
                "attemptsRemaining", policy.maxLoginAttempts() - attempts
        ));
        log.info("Login failed for user {} ({} of {})", user.getId(), attempts, policy.maxLoginAttempts());
        return AuthResult.fail(AuthFailure.INVALID_CREDENTIAL);
    }

    private void audit(String action, NestUser user, String ip, Map<String, Object> detail) {
        auditLogService.record(AuditLogCommand.forUser(action, user.getId(), ip, detail));
    }

    private static String normalize(String email) {
        return email == null ? "" : email.trim().toLowerCase(Locale.ROOT);
    }

    private static String truncate(String value) {
        if (value.isEmpty()) {
            return "-";
        }
        return value.length() <= MAX_AUDIT_KEY_LENGTH ? value : value.substring(0, MAX_AUDIT_KEY_LENGTH);
    }
}
