package com.nestfind.backend.modules.auth.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.nestfind.backend.modules.auth.domain.NestUser;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface NestUserRepository extends JpaRepository<NestUser, UUID> {

    Optional<NestUser> findByEmailIgnoreCase(String email);

    boolean existsByEmailIgnoreCase(String email);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select u from NestUser u where lower(u.email) = lower(:email)")
    Optional<NestUser> findByEmailForUpdate(@Param("email") String email);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select u from NestUser u where u.id = :id")
    Optional<NestUser> findByIdForUpdate(@Param("id") UUID id);
}
