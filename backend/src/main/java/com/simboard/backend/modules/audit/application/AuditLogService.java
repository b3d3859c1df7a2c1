package com.simboard.backend.modules.audit.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import com.simboard.backend.global.web.RequestIdFilter;
import com.simboard.backend.modules.audit.domain.AuditLog;
import com.simboard.backend.modules.audit.infrastructure.AuditLogRepository;
import com.simboard.backend.modules.user.domain.AppUser;

import jakarta.persistence.EntityManager;

import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class AuditLogService {

    public static final String ACTION_TOKEN_ISSUED = "TOKEN_ISSUED";
    public static final String ACTION_TOKEN_REVOKED = "TOKEN_REVOKED";
    public static final String ACTION_SERVICE_ACCOUNT_CREATED = "SERVICE_ACCOUNT_CREATED";

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
        auditLog.setCreatedAt(OffsetDateTime.now(clock));
        auditLog.setRequestId(MDC.get(RequestIdFilter.REQUEST_ID_MDC_KEY));

        if (command.actorUserId() != null) {
            auditLog.setActor(entityManager.getReference(AppUser.class, command.actorUserId()));
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
            Map<String, Object> detail
    ) {
    }
}
