package com.expenseflow.backend.modules.report.domain;

import java.util.List;

import com.expenseflow.backend.modules.notification.domain.NotificationDescriptor;

/**
 * Outcome of a state machine step. {@code changed == false} means the request was an idempotent
 * repeat and nothing must be written.
 */
public record TransitionResult(
        ReportLedgerEntry entry,
        ReportStatus previousStatus,
        List<NotificationDescriptor> notifications,
        boolean changed
) {

    public static TransitionResult unchanged(ReportLedgerEntry entry) {
        return new TransitionResult(entry, entry.getStatus(), List.of(), false);
    }
}
