package com.nestfind.backend.modules.auth.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.nestfind.backend.modules.auth.domain.OtpVerification;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;

public interface OtpVerificationRepository extends JpaRepository<OtpVerification, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    Optional<OtpVerification> findFirstByUser_IdAndConsumedAtIsNullOrderByCreatedAtDesc(UUID userId);

    Optional<OtpVerification> findFirstByUser_IdOrderByCreatedAtDesc(UUID userId);
}
