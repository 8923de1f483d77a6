package com.nestfind.backend.modules.audit.infrastructure;

import java.util.List;
import java.util.UUID;

import com.nestfind.backend.modules.audit.domain.AuditLog;

import org.springframework.data.jpa.repository.JpaRepository;

public interface AuditLogRepository extends JpaRepository<AuditLog, UUID> {

    List<AuditLog> findByActionTypeOrderByCreatedAtAsc(String actionType);

    List<AuditLog> findByResourceKeyOrderByCreatedAtAsc(String resourceKey);
}
