package com.expenseflow.backend.modules.report.presentation.dto;

import java.time.OffsetDateTime;

import com.expenseflow.backend.modules.report.domain.ReportLedgerEntry;
import com.expenseflow.backend.modules.report.domain.ReportStatus;

public record ReportResponse(
        String reportId,
        String employeeId,
        String supervisorId,
        ReportStatus status,
        OffsetDateTime submittedAt,
        OffsetDateTime reviewedAt,
        String reviewerId,
        String reviewerName,
        String comments,
        OffsetDateTime updatedAt
) {

    public static ReportResponse from(ReportLedgerEntry entry) {
        return new ReportResponse(
                entry.getReportId(),
                entry.getEmployeeId(),
                entry.getSupervisorId(),
                entry.getStatus(),
                entry.getSubmittedAt(),
                entry.getReviewedAt(),
                entry.getReviewerId(),
                entry.getReviewerName(),
                entry.getComments(),
                entry.getUpdatedAt()
        );
    }
}
