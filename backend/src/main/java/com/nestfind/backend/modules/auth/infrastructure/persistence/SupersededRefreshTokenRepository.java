package com.nestfind.backend.modules.auth.infrastructure.persistence;

import com.nestfind.backend.modules.auth.domain.SupersededRefreshToken;

import org.springframework.data.jpa.repository.JpaRepository;

public interface SupersededRefreshTokenRepository extends JpaRepository<SupersededRefreshToken, String> {
}
