package com.expenseflow.backend.modules.notification.domain;

/**
 * Which inbox a notification lands in: the reviewer's queue or the employee's own inbox.
 */
public enum RecipientRole {
    SUPERVISOR,
    STAFF
}
