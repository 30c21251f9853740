package com.expenseflow.backend.modules.report.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record SendMessageRequest(
        @NotBlank(message = "employeeId is required")
        String employeeId,
        @NotBlank(message = "supervisorId is required")
        String supervisorId,
        String supervisorName,
        String message
) {
}
