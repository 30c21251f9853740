package com.expenseflow.backend.modules.notification.domain;

/**
 * A notification to be written, described but not yet persisted.
 */
public record NotificationDescriptor(
        String recipientId,
        RecipientRole recipientRole,
        NotificationType type,
        String message,
        String reportId,
        String senderId,
        String senderName
) {
}
