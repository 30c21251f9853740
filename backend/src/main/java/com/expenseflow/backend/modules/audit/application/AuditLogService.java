package com.expenseflow.backend.modules.audit.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.expenseflow.backend.global.web.RequestIdFilter;
import com.expenseflow.backend.modules.audit.domain.AuditLog;
import com.expenseflow.backend.modules.audit.infrastructure.AuditLogRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Append-only trail of report transitions and directory changes.
 * Records join the caller's transaction so a rolled-back change leaves no trace.
 */
@Service
public class AuditLogService {

    public static final String RESOURCE_REPORT = "REPORT";
    public static final String RESOURCE_EMPLOYEE = "EMPLOYEE";

    private final AuditLogRepository auditLogRepository;
    private final Clock clock;

    public AuditLogService(AuditLogRepository auditLogRepository, Clock clock) {
        this.auditLogRepository = auditLogRepository;
        this.clock = clock;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public AuditLog record(AuditLogCommand command) {
        Objects.requireNonNull(command.actionType(), "actionType is required");
        Objects.requireNonNull(command.resourceType(), "resourceType is required");
        Objects.requireNonNull(command.resourceKey(), "resourceKey is required");

        AuditLog auditLog = new AuditLog();
        auditLog.setActionType(command.actionType());
        auditLog.setResourceType(command.resourceType());
        auditLog.setResourceKey(command.resourceKey());
        auditLog.setActorId(command.actorId());
        auditLog.setCorrelationId(RequestIdFilter.currentRequestId().orElse(null));
        auditLog.setCreatedAt(OffsetDateTime.now(clock));

        if (command.detail() != null && !command.detail().isEmpty()) {
            auditLog.setDetail(new LinkedHashMap<>(command.detail()));
        }

        return auditLogRepository.save(auditLog);
    }

    @Transactional(readOnly = true)
    public List<AuditLog> findTrail(String resourceType, String resourceKey) {
        return auditLogRepository.findByResourceTypeAndResourceKeyOrderByCreatedAtDesc(resourceType, resourceKey);
    }

    public record AuditLogCommand(
            String actionType,
            String resourceType,
            String resourceKey,
            String actorId,
            Map<String, Object> detail
    ) {
    }
}
