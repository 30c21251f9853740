package com.expenseflow.backend.modules.notification.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.expenseflow.backend.modules.notification.domain.Notification;

public record NotificationItemResponse(
        UUID id,
        String recipientId,
        String recipientRole,
        String type,
        String message,
        String reportId,
        String senderId,
        String senderName,
        boolean isRead,
        OffsetDateTime createdAt,
        OffsetDateTime readAt
) {

    public static NotificationItemResponse from(Notification notification) {
        return new NotificationItemResponse(
                notification.getId(),
                notification.getRecipientId(),
                notification.getRecipientRole().name(),
                notification.getType().name(),
                notification.getMessage(),
                notification.getReportId(),
                notification.getSenderId(),
                notification.getSenderName(),
                notification.isRead(),
                notification.getCreatedAt(),
                notification.getReadAt()
        );
    }
}
