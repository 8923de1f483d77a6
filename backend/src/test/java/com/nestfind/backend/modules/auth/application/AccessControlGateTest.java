package com.nestfind.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import com.nestfind.backend.global.error.ProblemException;
import com.nestfind.backend.modules.auth.application.AccessTokenIssuer.AccessTokenClaims;
import com.nestfind.backend.modules.auth.application.SessionRegistry.ActiveSession;
import com.nestfind.backend.modules.auth.domain.AuthFailure;
import com.nestfind.backend.modules.auth.domain.AuthResult;
import com.nestfind.backend.modules.auth.domain.NestUser;
import com.nestfind.backend.modules.auth.domain.NestUserStatus;
import com.nestfind.backend.modules.auth.domain.Role;
import com.nestfind.backend.modules.auth.domain.UserRole;
import com.nestfind.backend.modules.auth.infrastructure.persistence.NestUserRepository;
import com.nestfind.backend.modules.auth.infrastructure.persistence.UserRoleRepository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class AccessControlGateTest {

    private static final OffsetDateTime NOW = OffsetDateTime.of(2026, 3, 1, 9, 0, 0, 0, ZoneOffset.UTC);
    private static final String TOKEN = "header.payload.signature";

    @Mock
    private AccessTokenIssuer accessTokenIssuer;

    @Mock
    private SessionRegistry sessionRegistry;

    @Mock
    private NestUserRepository nestUserRepository;

    @Mock
    private UserRoleRepository userRoleRepository;

    private AccessControlGate gate;
    private NestUser user;
    private UUID sessionId;

    @BeforeEach
    void setUp() {
        gate = new AccessControlGate(accessTokenIssuer, sessionRegistry, nestUserRepository, userRoleRepository);
        user = new NestUser();
        ReflectionTestUtils.setField(user, "id", UUID.randomUUID());
        user.setEmail("resident@nestfind.test");
        user.setStatus(NestUserStatus.ACTIVE);
        sessionId = UUID.randomUUID();
    }

    @Test
    void liveTokenResolvesCurrentStatusAndRoles() {
        stubToken(user.getId());
        stubSession(user.getId());
        when(nestUserRepository.findById(user.getId())).thenReturn(Optional.of(user));
        when(userRoleRepository.findActiveRoles(user.getId())).thenReturn(List.of(grant(Role.USER), grant(Role.ADMIN)));

        AuthResult<AuthenticatedUser> result = gate.authenticate(TOKEN);

        assertThat(result.success()).isTrue();
        AuthenticatedUser caller = result.value();
        assertThat(caller.userId()).isEqualTo(user.getId());
        assertThat(caller.sessionId()).isEqualTo(sessionId);
        assertThat(caller.email()).isEqualTo("resident@nestfind.test");
        assertThat(caller.roles()).containsExactly(Role.ADMIN, Role.USER);
        assertThat(caller.isActive()).isTrue();
    }

    @Test
    void statusChangeIsVisibleWithoutNewToken() {
        stubToken(user.getId());
        stubSession(user.getId());
        user.setStatus(NestUserStatus.SUSPENDED);
        when(nestUserRepository.findById(user.getId())).thenReturn(Optional.of(user));
        when(userRoleRepository.findActiveRoles(user.getId())).thenReturn(List.of(grant(Role.ADMIN)));

        AuthenticatedUser caller = gate.authenticate(TOKEN).value();

        assertThat(caller.status()).isEqualTo(NestUserStatus.SUSPENDED);
        assertThatThrownBy(() -> gate.requireRole(caller, Role.ADMIN))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
                    assertThat(ex.getCode()).isEqualTo("ACCOUNT_NOT_ACTIVE");
                });
    }

    @Test
    void undecodableTokenNeverTouchesTheStore() {
        when(accessTokenIssuer.decode(TOKEN)).thenReturn(AuthResult.fail(AuthFailure.TOKEN_EXPIRED));

        assertThat(gate.authenticate(TOKEN).failure()).isEqualTo(AuthFailure.TOKEN_EXPIRED);
        verify(sessionRegistry, never()).verify(any());
    }

    @Test
    void revokedSessionRejectsOtherwiseValidToken() {
        stubToken(user.getId());
        when(sessionRegistry.verify(sessionId)).thenReturn(AuthResult.fail(AuthFailure.SESSION_REVOKED));

        assertThat(gate.authenticate(TOKEN).failure()).isEqualTo(AuthFailure.SESSION_REVOKED);
        verify(nestUserRepository, never()).findById(any());
    }

    @Test
    void sessionOwnedBySomeoneElseIsInvalid() {
        stubToken(user.getId());
        stubSession(UUID.randomUUID());

        assertThat(gate.authenticate(TOKEN).failure()).isEqualTo(AuthFailure.TOKEN_INVALID);
    }

    @Test
    void missingUserIsInvalid() {
        stubToken(user.getId());
        stubSession(user.getId());
        when(nestUserRepository.findById(user.getId())).thenReturn(Optional.empty());

        assertThat(gate.authenticate(TOKEN).failure()).isEqualTo(AuthFailure.TOKEN_INVALID);
    }

    @Test
    void requireRoleChecksMembership() {
        AuthenticatedUser resident = new AuthenticatedUser(
                user.getId(), sessionId, user.getEmail(), NestUserStatus.ACTIVE, Set.of(Role.USER));

        assertThatCode(() -> gate.requireRole(resident, Role.USER)).doesNotThrowAnyException();
        assertThatThrownBy(() -> gate.requireRole(resident, Role.ADMIN))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("FORBIDDEN"));
    }

    @Test
    void pendingUserIsNotActive() {
        AuthenticatedUser pending = new AuthenticatedUser(
                user.getId(), sessionId, user.getEmail(), NestUserStatus.PENDING_VERIFICATION, Set.of(Role.USER));

        assertThatThrownBy(() -> gate.requireActive(pending)).isInstanceOf(ProblemException.class);
    }

    private void stubToken(UUID subject) {
        when(accessTokenIssuer.decode(TOKEN)).thenReturn(AuthResult.ok(
                new AccessTokenClaims(subject, sessionId, UUID.randomUUID().toString(), NOW, NOW.plusMinutes(15))));
    }

    private void stubSession(UUID owner) {
        when(sessionRegistry.verify(sessionId)).thenReturn(AuthResult.ok(
                new ActiveSession(sessionId, owner, UUID.randomUUID(), NOW.plusDays(7))));
    }

    private static UserRole grant(String code) {
        Role role = new Role();
        role.setCode(code);
        UserRole userRole = new UserRole();
        userRole.setRole(role);
        return userRole;
    }
}
