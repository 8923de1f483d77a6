package com.nestfind.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Pattern;

import com.nestfind.backend.global.error.ProblemException;
import com.nestfind.backend.modules.audit.application.AuditLogService;
import com.nestfind.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.nestfind.backend.modules.auth.application.OtpVerifier.IssuedOtp;
import com.nestfind.backend.modules.auth.domain.AccountType;
import com.nestfind.backend.modules.auth.domain.NestUser;
import com.nestfind.backend.modules.auth.domain.NestUserStatus;
import com.nestfind.backend.modules.auth.domain.Role;
import com.nestfind.backend.modules.auth.domain.UserRole;
import com.nestfind.backend.modules.auth.infrastructure.persistence.NestUserRepository;
import com.nestfind.backend.modules.auth.infrastructure.persistence.RoleRepository;
import com.nestfind.backend.modules.auth.infrastructure.persistence.UserRoleRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Self-service sign-up. New accounts start in PENDING_VERIFICATION and are sent a verification
 * code once the account row has committed.
 */
@Service
public class RegistrationService {

    private static final Logger log = LoggerFactory.getLogger(RegistrationService.class);

    private static final int MIN_PASSWORD_LENGTH = 8;
    private static final Pattern HAS_LETTER = Pattern.compile("[A-Za-z]");
    private static final Pattern HAS_DIGIT = Pattern.compile("\\d");

    private final NestUserRepository nestUserRepository;
    private final RoleRepository roleRepository;
    private final UserRoleRepository userRoleRepository;
    private final PasswordEncoder passwordEncoder;
    private final AuditLogService auditLogService;
    private final OtpVerifier otpVerifier;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public RegistrationService(
            NestUserRepository nestUserRepository,
            RoleRepository roleRepository,
            UserRoleRepository userRoleRepository,
            PasswordEncoder passwordEncoder,
            AuditLogService auditLogService,
            OtpVerifier otpVerifier,
            PlatformTransactionManager transactionManager,
            Clock clock
    ) {
        this.nestUserRepository = nestUserRepository;
        this.roleRepository = roleRepository;
        this.userRoleRepository = userRoleRepository;
        this.passwordEncoder = passwordEncoder;
        this.auditLogService = auditLogService;
        this.otpVerifier = otpVerifier;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    public Registration register(RegistrationCommand command, String ip) {
        validatePassword(command.password());
        String email = command.email().trim().toLowerCase(Locale.ROOT);
        AccountType accountType = command.accountType() != null ? command.accountType() : AccountType.USER;

        UUID userId;
        try {
            userId = transactionTemplate.execute(status -> createPendingUser(command, email, accountType, ip));
        } catch (DataIntegrityViolationException ex) {
            // concurrent sign-up with the same email
            log.info("Registration rejected by unique constraint");
            throw registrationFailed();
        }
        if (userId == null) {
            throw new IllegalStateException("Registration returned no user id");
        }

        IssuedOtp otp = otpVerifier.generateAndStore(userId, ip);
        return new Registration(userId, otp.expiresAt(), otp.delivered());
    }

    static void validatePassword(String password) {
        if (password == null
                || password.length() < MIN_PASSWORD_LENGTH
                || !HAS_LETTER.matcher(password).find()
                || !HAS_DIGIT.matcher(password).find()) {
            throw new ProblemException(
                    HttpStatus.UNPROCESSABLE_ENTITY,
                    "WEAK_PASSWORD",
                    "Password must be at least 8 characters and contain a letter and a digit"
            );
        }
    }

    private UUID createPendingUser(RegistrationCommand command, String email, AccountType accountType, String ip) {
        if (nestUserRepository.existsByEmailIgnoreCase(email)) {
            log.info("Registration rejected for an existing email");
            throw registrationFailed();
        }
        Role role = roleRepository.findById(accountType.roleCode())
                .orElseThrow(() -> new IllegalStateException("Role not seeded: " + accountType.roleCode()));

        NestUser user = new NestUser();
        user.setEmail(email);
        user.setFullName(command.fullName().trim());
        user.setMobileNumber(command.mobileNumber());
        user.setPasswordHash(passwordEncoder.encode(command.password()));
        user.setStatus(NestUserStatus.PENDING_VERIFICATION);
        NestUser saved = nestUserRepository.saveAndFlush(user);

        UserRole grant = new UserRole();
        grant.setUser(saved);
        grant.setRole(role);
        grant.setGrantedAt(OffsetDateTime.now(clock));
        userRoleRepository.save(grant);

        auditLogService.record(AuditLogCommand.forUser(
                "SIGNUP_INITIATED", saved.getId(), ip, Map.of("accountType", accountType.name())));
        log.info("User {} registered as {}", saved.getId(), accountType);
        return saved.getId();
    }

    private static ProblemException registrationFailed() {
        return new ProblemException(HttpStatus.BAD_REQUEST, "REGISTRATION_FAILED", "Registration failed");
    }

    public record RegistrationCommand(
            String fullName,
            String email,
            String password,
            String mobileNumber,
            AccountType accountType
    ) {
    }

    public record Registration(UUID userId, OffsetDateTime otpExpiresAt, boolean otpDelivered) {
    }
}
