package com.nestfind.backend.modules.auth.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.nestfind.backend.modules.auth.domain.UserSession;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface UserSessionRepository extends JpaRepository<UserSession, UUID> {

    @Query("""
            select us
              from UserSession us
              join fetch us.user
             where us.id = :id
            """)
    Optional<UserSession> findWithUserById(@Param("id") UUID id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select us from UserSession us where us.id = :id")
    Optional<UserSession> findByIdForUpdate(@Param("id") UUID id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select us from UserSession us where us.refreshTokenHash = :hash")
    Optional<UserSession> findByRefreshTokenHashForUpdate(@Param("hash") String refreshTokenHash);

    Optional<UserSession> findFirstByParentTokenHash(String parentTokenHash);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
            select us
              from UserSession us
             where us.user.id = :userId
               and us.revokedAt is null
            """)
    List<UserSession> findUnrevokedByUserIdForUpdate(@Param("userId") UUID userId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
            select us
              from UserSession us
             where us.tokenFamilyId = :familyId
               and us.revokedAt is null
            """)
    List<UserSession> findUnrevokedByFamilyForUpdate(@Param("familyId") UUID familyId);

    List<UserSession> findByTokenFamilyId(UUID tokenFamilyId);
}
