package com.expenseflow.backend.modules.notification.presentation.dto;

public record MarkAllReadResponse(int updated) {
}
