package com.nestfind.backend.modules.auth.application;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.nestfind.backend.global.error.ProblemException;
import com.nestfind.backend.modules.audit.application.AuditLogService;
import com.nestfind.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.nestfind.backend.modules.auth.domain.AuthFailure;
import com.nestfind.backend.modules.auth.domain.AuthResult;
import com.nestfind.backend.modules.auth.domain.NestUser;
import com.nestfind.backend.modules.auth.domain.NestUserStatus;
import com.nestfind.backend.modules.auth.domain.OtpVerification;
import com.nestfind.backend.modules.auth.infrastructure.persistence.NestUserRepository;
import com.nestfind.backend.modules.auth.infrastructure.persistence.OtpVerificationRepository;
import com.nestfind.backend.modules.auth.infrastructure.persistence.UserRoleRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Single-use email verification codes.
 *
 * <p>Only the latest unconsumed code of a user can be checked. Verification locks the user row
 * first and then the code row, so concurrent submissions of the same code are serialised and at
 * most one of them consumes it. Wrong guesses count against the code; exhausting them places the
 * same account lock that password login uses.
 */
@Service
public class OtpVerifier {

    private static final Logger log = LoggerFactory.getLogger(OtpVerifier.class);

    private final NestUserRepository nestUserRepository;
    private final OtpVerificationRepository otpVerificationRepository;
    private final UserRoleRepository userRoleRepository;
    private final AuditLogService auditLogService;
    private final OtpMailSender otpMailSender;
    private final TokenHasher tokenHasher;
    private final AuthPolicyProperties policy;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final SecureRandom secureRandom = new SecureRandom();

    public OtpVerifier(
            NestUserRepository nestUserRepository,
            OtpVerificationRepository otpVerificationRepository,
            UserRoleRepository userRoleRepository,
            AuditLogService auditLogService,
            OtpMailSender otpMailSender,
            TokenHasher tokenHasher,
            AuthPolicyProperties policy,
            PlatformTransactionManager transactionManager,
            Clock clock
    ) {
        this.nestUserRepository = nestUserRepository;
        this.otpVerificationRepository = otpVerificationRepository;
        this.userRoleRepository = userRoleRepository;
        this.auditLogService = auditLogService;
        this.otpMailSender = otpMailSender;
        this.tokenHasher = tokenHasher;
        this.policy = policy;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    /**
     * Stores a new code and mails it. The row commits before the mail goes out; a delivery
     * failure is audited and reported in the result but does not undo the stored code.
     */
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    public IssuedOtp generateAndStore(UUID userId, String ip) {
        PendingOtp pending = transactionTemplate.execute(status -> storeNewCode(userId, ip));
        if (pending == null) {
            throw new IllegalStateException("OTP generation returned no result");
        }

        boolean delivered = deliver(pending, ip);
        return new IssuedOtp(pending.otpId(), pending.expiresAt(), delivered);
    }

    @Transactional
    public AuthResult<NestUserStatus> verify(UUID userId, String code, String ip) {
        OffsetDateTime now = OffsetDateTime.now(clock);

        Optional<NestUser> lockedUser = nestUserRepository.findByIdForUpdate(userId);
        if (lockedUser.isEmpty()) {
            return AuthResult.fail(AuthFailure.OTP_NOT_FOUND);
        }
        NestUser user = lockedUser.get();

        if (user.isLockedAt(now)) {
            audit("OTP_LOCKED", userId, ip, Map.of("lockedUntil", user.getLoginLockedUntil().toString()));
            return AuthResult.locked(user.getLoginLockedUntil());
        }

        Optional<OtpVerification> latest =
                otpVerificationRepository.findFirstByUser_IdAndConsumedAtIsNullOrderByCreatedAtDesc(userId);
        if (latest.isEmpty()) {
            boolean lastWasConsumed = otpVerificationRepository.findFirstByUser_IdOrderByCreatedAtDesc(userId)
                    .map(OtpVerification::isConsumed)
                    .orElse(false);
            if (lastWasConsumed) {
                audit("OTP_REUSE_BLOCKED", userId, ip, Map.of());
                return AuthResult.fail(AuthFailure.OTP_REUSE_BLOCKED);
            }
            audit("OTP_NOT_FOUND", userId, ip, Map.of());
            return AuthResult.fail(AuthFailure.OTP_NOT_FOUND);
        }

        OtpVerification otp = latest.get();
        if (otp.isConsumed()) {
            audit("OTP_REUSE_BLOCKED", userId, ip, Map.of("otpId", otp.getId().toString()));
            return AuthResult.fail(AuthFailure.OTP_REUSE_BLOCKED);
        }
        if (otp.isExpiredAt(now)) {
            audit("OTP_EXPIRED", userId, ip, Map.of("otpId", otp.getId().toString()));
            return AuthResult.fail(AuthFailure.OTP_EXPIRED);
        }

        String candidate = code == null ? "" : tokenHasher.hashOtp(userId, code.trim());
        if (!tokenHasher.matches(otp.getOtpHash(), candidate)) {
            return recordWrongGuess(user, otp, now, ip);
        }

        otp.consume(now, ip);
        if (user.getStatus() == NestUserStatus.PENDING_VERIFICATION) {
            NestUserStatus next = requiresApproval(userId) ? NestUserStatus.IN_REVIEW : NestUserStatus.ACTIVE;
            user.setStatus(next);
            user.setEmailVerifiedAt(now);
            audit("EMAIL_VERIFIED", userId, ip, Map.of("status", next.name()));
            log.info("User {} verified email, status now {}", userId, next);
        }
        audit("OTP_VERIFIED", userId, ip, Map.of("otpId", otp.getId().toString()));
        return AuthResult.ok(user.getStatus());
    }

    private AuthResult<NestUserStatus> recordWrongGuess(
            NestUser user,
            OtpVerification otp,
            OffsetDateTime now,
            String ip
    ) {
        int attempts = otp.getAttempts() + 1;
        otp.setAttempts(attempts);

        if (attempts >= policy.otpMaxAttempts()) {
            OffsetDateTime until = now.plus(policy.otpLockout());
            user.setLoginLockedUntil(until);
            audit("OTP_LOCKED", user.getId(), ip, Map.of(
                    "attempts", attempts,
                    "lockedUntil", until.toString(),
                    "reason", "max_otp_attempts"
            ));
            log.warn("User {} locked until {} after {} wrong verification codes", user.getId(), until, attempts);
            return AuthResult.locked(until);
        }

        int remaining = policy.otpMaxAttempts() - attempts;
        audit("OTP_FAILED", user.getId(), ip, Map.of("attempts", attempts, "attemptsRemaining", remaining));
        return AuthResult.otpInvalid(remaining);
    }

    private PendingOtp storeNewCode(UUID userId, String ip) {
        NestUser user = nestUserRepository.findById(userId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "USER_NOT_FOUND", "User not found"));

        String code = randomDigits(policy.otpLength());
        OffsetDateTime expiresAt = OffsetDateTime.now(clock).plus(policy.otpTtl());

        OtpVerification otp = new OtpVerification();
        otp.setUser(user);
        otp.setOtpHash(tokenHasher.hashOtp(userId, code));
        otp.setExpiresAt(expiresAt);
        otp.setAttempts(0);
        OtpVerification saved = otpVerificationRepository.save(otp);

        audit("OTP_GENERATED", userId, ip, Map.of(
                "otpId", saved.getId().toString(),
                "expiresAt", expiresAt.toString()
        ));
        return new PendingOtp(saved.getId(), userId, user.getEmail(), code, expiresAt);
    }

    private boolean deliver(PendingOtp pending, String ip) {
        Map<String, Object> detail = new HashMap<>();
        detail.put("otpId", pending.otpId().toString());
        try {
            otpMailSender.sendOtp(pending.email(), pending.code());
        } catch (RuntimeException ex) {
            log.error("Failed to deliver verification code {} for user {}", pending.otpId(), pending.userId(), ex);
            detail.put("error", ex.getClass().getSimpleName());
            transactionTemplate.executeWithoutResult(status ->
                    audit("EMAIL_OTP_FAILED", pending.userId(), ip, detail));
            return false;
        }
        transactionTemplate.executeWithoutResult(status ->
                audit("EMAIL_OTP_SENT", pending.userId(), ip, detail));
        return true;
    }

    private boolean requiresApproval(UUID userId) {
        return userRoleRepository.findActiveRoles(userId).stream()
                .anyMatch(userRole -> userRole.getRole().isRequiresApproval());
    }

    private String randomDigits(int length) {
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(secureRandom.nextInt(10));
        }
        return sb.toString();
    }

    private void audit(String action, UUID userId, String ip, Map<String, Object> detail) {
        auditLogService.record(AuditLogCommand.forUser(action, userId, ip, detail));
    }

    /** Plaintext code lives only here, between commit and delivery. */
    private record PendingOtp(UUID otpId, UUID userId, String email, String code, OffsetDateTime expiresAt) {
    }

    public record IssuedOtp(UUID otpId, OffsetDateTime expiresAt, boolean delivered) {
    }
}
