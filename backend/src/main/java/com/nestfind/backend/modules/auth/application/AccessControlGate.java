package com.nestfind.backend.modules.auth.application;

import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;

import com.nestfind.backend.global.error.ProblemException;
import com.nestfind.backend.modules.auth.application.AccessTokenIssuer.AccessTokenClaims;
import com.nestfind.backend.modules.auth.application.SessionRegistry.ActiveSession;
import com.nestfind.backend.modules.auth.domain.AuthFailure;
import com.nestfind.backend.modules.auth.domain.AuthResult;
import com.nestfind.backend.modules.auth.domain.NestUser;
import com.nestfind.backend.modules.auth.infrastructure.persistence.NestUserRepository;
import com.nestfind.backend.modules.auth.infrastructure.persistence.UserRoleRepository;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Resolves a bearer token into the caller's current identity. The token only names a user and a
 * session; the session must still be live, and status and roles are re-read on every call, so
 * suspensions and role changes apply from the next request on.
 */
@Service
@Transactional(readOnly = true)
public class AccessControlGate {

    private final AccessTokenIssuer accessTokenIssuer;
    private final SessionRegistry sessionRegistry;
    private final NestUserRepository nestUserRepository;
    private final UserRoleRepository userRoleRepository;

    public AccessControlGate(
            AccessTokenIssuer accessTokenIssuer,
            SessionRegistry sessionRegistry,
            NestUserRepository nestUserRepository,
            UserRoleRepository userRoleRepository
    ) {
        this.accessTokenIssuer = accessTokenIssuer;
        this.sessionRegistry = sessionRegistry;
        this.nestUserRepository = nestUserRepository;
        this.userRoleRepository = userRoleRepository;
    }

    public AuthResult<AuthenticatedUser> authenticate(String token) {
        AuthResult<AccessTokenClaims> decoded = accessTokenIssuer.decode(token);
        if (!decoded.success()) {
            return decoded.propagate();
        }
        AccessTokenClaims claims = decoded.value();

        AuthResult<ActiveSession> session = sessionRegistry.verify(claims.sessionId());
        if (!session.success()) {
            return session.propagate();
        }
        if (!session.value().userId().equals(claims.userId())) {
            return AuthResult.fail(AuthFailure.TOKEN_INVALID);
        }

        Optional<NestUser> user = nestUserRepository.findById(claims.userId());
        if (user.isEmpty()) {
            return AuthResult.fail(AuthFailure.TOKEN_INVALID);
        }
        return AuthResult.ok(new AuthenticatedUser(
                claims.userId(),
                claims.sessionId(),
                user.get().getEmail(),
                user.get().getStatus(),
                activeRoleCodes(claims.userId())
        ));
    }

    public void requireActive(AuthenticatedUser user) {
        if (!user.isActive()) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "ACCOUNT_NOT_ACTIVE", "Account is not active");
        }
    }

    public void requireRole(AuthenticatedUser user, String roleCode) {
        requireActive(user);
        if (!user.hasRole(roleCode)) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "FORBIDDEN", "Insufficient role");
        }
    }

    public Set<String> activeRoleCodes(UUID userId) {
        Set<String> codes = new TreeSet<>();
        userRoleRepository.findActiveRoles(userId).forEach(userRole -> codes.add(userRole.getRole().getCode()));
        return codes;
    }
}
