package com.nestfind.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import com.nestfind.backend.global.error.ProblemException;
import com.nestfind.backend.modules.audit.application.AuditLogService;
import com.nestfind.backend.modules.auth.application.OtpVerifier.IssuedOtp;
import com.nestfind.backend.modules.auth.application.RegistrationService.Registration;
import com.nestfind.backend.modules.auth.application.RegistrationService.RegistrationCommand;
import com.nestfind.backend.modules.auth.domain.AccountType;
import com.nestfind.backend.modules.auth.domain.NestUser;
import com.nestfind.backend.modules.auth.domain.NestUserStatus;
import com.nestfind.backend.modules.auth.domain.Role;
import com.nestfind.backend.modules.auth.domain.UserRole;
import com.nestfind.backend.modules.auth.infrastructure.persistence.NestUserRepository;
import com.nestfind.backend.modules.auth.infrastructure.persistence.RoleRepository;
import com.nestfind.backend.modules.auth.infrastructure.persistence.UserRoleRepository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.transaction.PlatformTransactionManager;

@ExtendWith(MockitoExtension.class)
class RegistrationServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T09:00:00Z");
    private static final String IP = "198.51.100.20";

    @Mock
    private NestUserRepository nestUserRepository;

    @Mock
    private RoleRepository roleRepository;

    @Mock
    private UserRoleRepository userRoleRepository;

    @Mock
    private AuditLogService auditLogService;

    @Mock
    private OtpVerifier otpVerifier;

    @Mock
    private PlatformTransactionManager transactionManager;

    private final BCryptPasswordEncoder passwordEncoder = new BCryptPasswordEncoder(4);
    private RegistrationService registrationService;

    @BeforeEach
    void setUp() {
        registrationService = new RegistrationService(
                nestUserRepository,
                roleRepository,
                userRoleRepository,
                passwordEncoder,
                auditLogService,
                otpVerifier,
                transactionManager,
                Clock.fixed(NOW, ZoneOffset.UTC)
        );
    }

    @Test
    void agentSignUpStartsPendingWithAgentRoleAndSendsCode() {
        Role agent = role(Role.AGENT, true);
        when(nestUserRepository.existsByEmailIgnoreCase("agent@nestfind.test")).thenReturn(false);
        when(roleRepository.findById(Role.AGENT)).thenReturn(Optional.of(agent));
        when(nestUserRepository.saveAndFlush(any(NestUser.class))).thenAnswer(invocation -> {
            NestUser saved = invocation.getArgument(0);
            ReflectionTestUtils.setField(saved, "id", UUID.randomUUID());
            return saved;
        });
        OffsetDateTime otpExpiry = OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC).plusMinutes(10);
        when(otpVerifier.generateAndStore(any(UUID.class), any()))
                .thenReturn(new IssuedOtp(UUID.randomUUID(), otpExpiry, true));

        Registration registration = registrationService.register(new RegistrationCommand(
                " Dana Broker ", " Agent@NestFind.test ", "letmein42", "+15550100", AccountType.AGENT), IP);

        ArgumentCaptor<NestUser> created = ArgumentCaptor.forClass(NestUser.class);
        verify(nestUserRepository).saveAndFlush(created.capture());
        NestUser user = created.getValue();
        assertThat(user.getEmail()).isEqualTo("agent@nestfind.test");
        assertThat(user.getFullName()).isEqualTo("Dana Broker");
        assertThat(user.getStatus()).isEqualTo(NestUserStatus.PENDING_VERIFICATION);
        assertThat(user.getPasswordHash()).isNotEqualTo("letmein42");
        assertThat(passwordEncoder.matches("letmein42", user.getPasswordHash())).isTrue();

        ArgumentCaptor<UserRole> grant = ArgumentCaptor.forClass(UserRole.class);
        verify(userRoleRepository).save(grant.capture());
        assertThat(grant.getValue().getRole()).isSameAs(agent);

        assertThat(registration.userId()).isEqualTo(user.getId());
        assertThat(registration.otpExpiresAt()).isEqualTo(otpExpiry);
        assertThat(registration.otpDelivered()).isTrue();
        verify(otpVerifier).generateAndStore(user.getId(), IP);
    }

    @Test
    void existingEmailFailsWithGenericError() {
        when(nestUserRepository.existsByEmailIgnoreCase("taken@nestfind.test")).thenReturn(true);

        assertThatThrownBy(() -> registrationService.register(new RegistrationCommand(
                "Taken", "taken@nestfind.test", "letmein42", null, null), IP))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
                    assertThat(ex.getCode()).isEqualTo("REGISTRATION_FAILED");
                });
        verify(otpVerifier, never()).generateAndStore(any(), anyString());
    }

    @Test
    void uniqueConstraintRaceMapsToTheSameError() {
        when(nestUserRepository.existsByEmailIgnoreCase("race@nestfind.test")).thenReturn(false);
        when(roleRepository.findById(Role.USER)).thenReturn(Optional.of(role(Role.USER, false)));
        when(nestUserRepository.saveAndFlush(any(NestUser.class)))
                .thenThrow(new DataIntegrityViolationException("uq_nest_user_email"));

        assertThatThrownBy(() -> registrationService.register(new RegistrationCommand(
                "Race", "race@nestfind.test", "letmein42", null, AccountType.USER), IP))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("REGISTRATION_FAILED"));
    }

    @ParameterizedTest
    @NullSource
    @ValueSource(strings = {"short1", "onlyletters", "1234567890"})
    void weakPasswordsAreRejected(String password) {
        assertThatThrownBy(() -> RegistrationService.validatePassword(password))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
                    assertThat(ex.getCode()).isEqualTo("WEAK_PASSWORD");
                });
    }

    @Test
    void acceptablePasswordPasses() {
        assertThatCode(() -> RegistrationService.validatePassword("correct horse 9")).doesNotThrowAnyException();
    }

    private static Role role(String code, boolean requiresApproval) {
        Role role = new Role();
        role.setCode(code);
        role.setName(code);
        role.setRequiresApproval(requiresApproval);
        return role;
    }
}
