package com.nestfind.backend.modules.auth.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * Hash of a refresh token that has been rotated away. Lets replay of any older generation
 * in a family be recognised, not only the immediate parent.
 */
@Entity
@Table(name = "superseded_refresh_token")
public class SupersededRefreshToken {

    @Id
    @Column(name = "token_hash", nullable = false, updatable = false, length = 128)
    private String tokenHash;

    @Column(name = "session_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID sessionId;

    @Column(name = "token_family_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID tokenFamilyId;

    @Column(name = "superseded_at", nullable = false, updatable = false)
    private OffsetDateTime supersededAt;

    protected SupersededRefreshToken() {
    }

    public SupersededRefreshToken(String tokenHash, UUID sessionId, UUID tokenFamilyId, OffsetDateTime supersededAt) {
        this.tokenHash = tokenHash;
        this.sessionId = sessionId;
        this.tokenFamilyId = tokenFamilyId;
        this.supersededAt = supersededAt;
    }

    public String getTokenHash() {
        return tokenHash;
    }

    public UUID getSessionId() {
        return sessionId;
    }

    public UUID getTokenFamilyId() {
        return tokenFamilyId;
    }

    public OffsetDateTime getSupersededAt() {
        return supersededAt;
    }
}
