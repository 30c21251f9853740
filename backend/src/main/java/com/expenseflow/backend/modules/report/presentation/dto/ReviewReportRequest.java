package com.expenseflow.backend.modules.report.presentation.dto;

import com.expenseflow.backend.modules.report.domain.ReviewerRole;

import jakarta.validation.constraints.NotBlank;

/**
 * Body of approve, reject and request-revision. The comment is checked by the workflow itself so that
 * a missing comment is reported as {@code MissingComment}.
 */
public record ReviewReportRequest(
        @NotBlank(message = "reportId is required")
        String reportId,
        @NotBlank(message = "reviewerId is required")
        String reviewerId,
        String reviewerName,
        ReviewerRole reviewerRole,
        String comments
) {

    public ReviewerRole reviewerRoleOrDefault() {
        return reviewerRole != null ? reviewerRole : ReviewerRole.SUPERVISOR;
    }
}
