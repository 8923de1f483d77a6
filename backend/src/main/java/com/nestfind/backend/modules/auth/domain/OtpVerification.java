package com.nestfind.backend.modules.auth.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.nestfind.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * One emailed verification code. Only the keyed hash is stored; consumed_at is permanent once set.
 */
@Entity
@Table(name = "email_otp_verification")
public class OtpVerification extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id", nullable = false)
    private NestUser user;

    @Column(name = "otp_hash", nullable = false, length = 128)
    private String otpHash;

    @Column(name = "expires_at", nullable = false)
    private OffsetDateTime expiresAt;

    @Column(name = "attempts", nullable = false)
    private int attempts;

    @Column(name = "consumed_at")
    private OffsetDateTime consumedAt;

    @Column(name = "consumed_by_ip", length = 64)
    private String consumedByIp;

    public UUID getId() {
        return id;
    }

    public NestUser getUser() {
        return user;
    }

    public void setUser(NestUser user) {
        this.user = user;
    }

    public String getOtpHash() {
        return otpHash;
    }

    public void setOtpHash(String otpHash) {
        this.otpHash = otpHash;
    }

    public OffsetDateTime getExpiresAt() {
        return expiresAt;
    }

    public void setExpiresAt(OffsetDateTime expiresAt) {
        this.expiresAt = expiresAt;
    }

    public int getAttempts() {
        return attempts;
    }

    public void setAttempts(int attempts) {
        this.attempts = attempts;
    }

    public OffsetDateTime getConsumedAt() {
        return consumedAt;
    }

    public String getConsumedByIp() {
        return consumedByIp;
    }

    public boolean isConsumed() {
        return consumedAt != null;
    }

    public boolean isExpiredAt(OffsetDateTime now) {
        return !expiresAt.isAfter(now);
    }

    public void consume(OffsetDateTime now, String ip) {
        if (consumedAt != null) {
            throw new IllegalStateException("OTP already consumed");
        }
        this.consumedAt = now;
        this.consumedByIp = ip;
    }
}
