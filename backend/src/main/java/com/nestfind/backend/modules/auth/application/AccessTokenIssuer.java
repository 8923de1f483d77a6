package com.nestfind.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.UUID;

import com.nestfind.backend.modules.auth.domain.AuthFailure;
import com.nestfind.backend.modules.auth.domain.AuthResult;
import com.nestfind.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Signs and decodes short-lived access tokens. Stateless: a decoded token only names a user and
 * a session, and authorization still has to consult the session and user rows.
 */
@Service
public class AccessTokenIssuer {

    private static final Logger log = LoggerFactory.getLogger(AccessTokenIssuer.class);

    static final String SESSION_ID_CLAIM = "session_id";

    private final JwtTokenProvider jwtTokenProvider;
    private final Clock clock;
    private final Duration accessTokenTtl;
    private final JwtParser parser;

    public AccessTokenIssuer(
            JwtTokenProvider jwtTokenProvider,
            Clock clock,
            @Value("${jwt.expiration:900000}") long accessTokenValidityMs
    ) {
        this.jwtTokenProvider = jwtTokenProvider;
        this.clock = clock;
        this.accessTokenTtl = Duration.ofMillis(accessTokenValidityMs);
        this.parser = Jwts.parser()
                .verifyWith(jwtTokenProvider.getSigningKey())
                .clock(() -> Date.from(clock.instant()))
                .build();
    }

    public IssuedAccessToken issue(UUID userId, UUID sessionId) {
        // JWT timestamps are whole seconds
        Instant issuedAt = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        Instant expiresAt = issuedAt.plus(accessTokenTtl);
        String jti = UUID.randomUUID().toString();

        String token = Jwts.builder()
                .subject(userId.toString())
                .id(jti)
                .claim(SESSION_ID_CLAIM, sessionId.toString())
                .issuedAt(Date.from(issuedAt))
                .expiration(Date.from(expiresAt))
                .signWith(jwtTokenProvider.getSigningKey(), jwtTokenProvider.getAlgorithm())
                .compact();

        return new IssuedAccessToken(token, jti, toOffset(issuedAt), toOffset(expiresAt));
    }

    /**
     * Verifies signature and expiry. Never throws for a bad token.
     */
    public AuthResult<AccessTokenClaims> decode(String token) {
        if (token == null || token.isBlank()) {
            return AuthResult.fail(AuthFailure.TOKEN_INVALID);
        }
        try {
            Claims claims = parser.parseSignedClaims(token).getPayload();
            Object sessionClaim = claims.get(SESSION_ID_CLAIM);
            if (claims.getSubject() == null
                    || claims.getIssuedAt() == null
                    || claims.getExpiration() == null
                    || !(sessionClaim instanceof String sessionId)) {
                return AuthResult.fail(AuthFailure.TOKEN_INVALID);
            }
            return AuthResult.ok(new AccessTokenClaims(
                    UUID.fromString(claims.getSubject()),
                    UUID.fromString(sessionId),
                    claims.getId(),
                    toOffset(claims.getIssuedAt().toInstant()),
                    toOffset(claims.getExpiration().toInstant())
            ));
        } catch (ExpiredJwtException ex) {
            log.debug("Access token expired: {}", ex.getMessage());
            return AuthResult.fail(AuthFailure.TOKEN_EXPIRED);
        } catch (JwtException | IllegalArgumentException ex) {
            log.debug("Access token rejected: {}", ex.getMessage());
            return AuthResult.fail(AuthFailure.TOKEN_INVALID);
        }
    }

    private static OffsetDateTime toOffset(Instant instant) {
        return OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    public record IssuedAccessToken(String token, String jti, OffsetDateTime issuedAt, OffsetDateTime expiresAt) {
    }

    public record AccessTokenClaims(
            UUID userId,
            UUID sessionId,
            String jti,
            OffsetDateTime issuedAt,
            OffsetDateTime expiresAt
    ) {
    }
}
