package com.nestfind.backend.modules.auth.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.nestfind.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * Account row. Also carries the lockout counter shared by password login and OTP verification.
 */
@Entity
@Table(name = "nest_user")
public class NestUser extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "email", nullable = false, length = 255)
    private String email;

    @Column(name = "password_hash", nullable = false, length = 255)
    private String passwordHash;

    @Column(name = "full_name", nullable = false, length = 120)
    private String fullName;

    @Column(name = "mobile_number", length = 32)
    private String mobileNumber;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private NestUserStatus status = NestUserStatus.PENDING_VERIFICATION;

    @Column(name = "login_attempts", nullable = false)
    private int loginAttempts;

    @Column(name = "login_locked_until")
    private OffsetDateTime loginLockedUntil;

    @Column(name = "email_verified_at")
    private OffsetDateTime emailVerifiedAt;

    public UUID getId() {
        return id;
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public String getPasswordHash() {
        return passwordHash;
    }

    public void setPasswordHash(String passwordHash) {
        this.passwordHash = passwordHash;
    }

    public String getFullName() {
        return fullName;
    }

    public void setFullName(String fullName) {
        this.fullName = fullName;
    }

    public String getMobileNumber() {
        return mobileNumber;
    }

    public void setMobileNumber(String mobileNumber) {
        this.mobileNumber = mobileNumber;
    }

    public NestUserStatus getStatus() {
        return status;
    }

    public void setStatus(NestUserStatus status) {
        this.status = status;
    }

    public int getLoginAttempts() {
        return loginAttempts;
    }

    public void setLoginAttempts(int loginAttempts) {
        this.loginAttempts = loginAttempts;
    }

    public OffsetDateTime getLoginLockedUntil() {
        return loginLockedUntil;
    }

    public void setLoginLockedUntil(OffsetDateTime loginLockedUntil) {
        this.loginLockedUntil = loginLockedUntil;
    }

    public OffsetDateTime getEmailVerifiedAt() {
        return emailVerifiedAt;
    }

    public void setEmailVerifiedAt(OffsetDateTime emailVerifiedAt) {
        this.emailVerifiedAt = emailVerifiedAt;
    }

    public boolean isLockedAt(OffsetDateTime now) {
        return loginLockedUntil != null && loginLockedUntil.isAfter(now);
    }

    /**
     * Clears a lock whose time has passed, together with the attempt counter it was guarding.
     */
    public void releaseElapsedLock(OffsetDateTime now) {
        if (loginLockedUntil != null && !loginLockedUntil.isAfter(now)) {
            loginLockedUntil = null;
            loginAttempts = 0;
        }
    }
}
