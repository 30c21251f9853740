package com.expenseflow.backend.modules.notification.domain;

public enum NotificationType {
    SUBMISSION,
    APPROVAL,
    REJECTION,
    REVISION,
    DIRECT_MESSAGE
}
