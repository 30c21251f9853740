package com.expenseflow.backend.modules.report.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record SubmitReportRequest(
        @NotBlank(message = "reportId is required")
        String reportId,
        @NotBlank(message = "employeeId is required")
        String employeeId,
        String supervisorId
) {
}
