package com.expenseflow.backend.modules.notification.presentation.dto;

public record UnreadCountResponse(long count) {
}
