package com.expenseflow.backend.modules.report.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.expenseflow.backend.modules.audit.domain.AuditLog;

public record ApprovalHistoryResponse(
        String reportId,
        List<ApprovalHistoryItem> items
) {

    public record ApprovalHistoryItem(
            UUID id,
            String action,
            String actorId,
            String correlationId,
            Map<String, Object> detail,
            OffsetDateTime createdAt
    ) {

        public static ApprovalHistoryItem from(AuditLog auditLog) {
            return new ApprovalHistoryItem(
                    auditLog.getId(),
                    auditLog.getActionType(),
                    auditLog.getActorId(),
                    auditLog.getCorrelationId(),
                    auditLog.getDetail() == null ? Map.of() : auditLog.getDetail(),
                    auditLog.getCreatedAt()
            );
        }
    }
}
