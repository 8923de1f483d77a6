package com.nestfind.backend.modules.audit.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import com.nestfind.backend.modules.audit.domain.AuditLog;
import com.nestfind.backend.modules.audit.infrastructure.AuditLogRepository;
import com.nestfind.backend.modules.auth.domain.NestUser;

import jakarta.persistence.EntityManager;

import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Append-only security audit trail. Joins the caller's transaction so the audit row commits or
 * rolls back together with the state change it describes. Callers must never put passwords,
 * OTP codes or tokens into {@code detail}.
 */
@Service
public class AuditLogService {

    private static final String REQUEST_ID_MDC_KEY = "requestId";

    private final AuditLogRepository auditLogRepository;
    private final EntityManager entityManager;
    private final Clock clock;

    public AuditLogService(AuditLogRepository auditLogRepository, EntityManager entityManager, Clock clock) {
        this.auditLogRepository = auditLogRepository;
        this.entityManager = entityManager;
        this.clock = clock;
    }

    @Transactional
    public void record(AuditLogCommand command) {
        Objects.requireNonNull(command.actionType(), "actionType is required");
        Objects.requireNonNull(command.resourceType(), "resourceType is required");
        Objects.requireNonNull(command.resourceKey(), "resourceKey is required");

        AuditLog auditLog = new AuditLog();
        auditLog.setActionType(command.actionType());
        auditLog.setResourceType(command.resourceType());
        auditLog.setResourceKey(command.resourceKey());
        auditLog.setIpAddress(command.ipAddress());
        auditLog.setCorrelationId(MDC.get(REQUEST_ID_MDC_KEY));
        auditLog.setCreatedAt(OffsetDateTime.now(clock));

        if (command.actorUserId() != null) {
            NestUser actorReference = entityManager.getReference(NestUser.class, command.actorUserId());
            auditLog.setActor(actorReference);
        }

        if (command.detail() != null && !command.detail().isEmpty()) {
            auditLog.setDetail(new HashMap<>(command.detail()));
        }

        auditLogRepository.save(auditLog);
    }

    public record AuditLogCommand(
            String actionType,
            String resourceType,
            String resourceKey,
            UUID actorUserId,
            String ipAddress,
            Map<String, Object> detail
    ) {

        public static AuditLogCommand forUser(String actionType, UUID userId, String ipAddress, Map<String, Object> detail) {
            return new AuditLogCommand(actionType, "USER", userId.toString(), userId, ipAddress, detail);
        }

        public static AuditLogCommand forSession(
                String actionType,
                UUID sessionId,
                UUID actorUserId,
                String ipAddress,
                Map<String, Object> detail
        ) {
            return new AuditLogCommand(actionType, "SESSION", sessionId.toString(), actorUserId, ipAddress, detail);
        }
    }
}
