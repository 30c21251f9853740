package com.expenseflow.backend.modules.report.domain;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

import com.expenseflow.backend.global.error.ProblemException;
import com.expenseflow.backend.modules.notification.domain.NotificationDescriptor;
import com.expenseflow.backend.modules.notification.domain.NotificationType;
import com.expenseflow.backend.modules.notification.domain.RecipientRole;

/**
 * Transition rules of the report approval workflow.
 *
 * <pre>
 * DRAFT ──submit──▶ SUBMITTED ──approve──▶ APPROVED
 *   ▲                   │ ──reject──────▶ REJECTED ───────┐
 *   │                   │ ──request_revision──▶ NEEDS_REVISION
 *   └──── submit from REJECTED / NEEDS_REVISION ◀──────────┘
 * </pre>
 *
 * <p>The machine mutates the entry it is given and returns the notifications that must be stored
 * with it. It never reads or writes storage; all guards run before the entry is touched.</p>
 */
public class ApprovalStateMachine {

    public static final String AUTO_APPROVER_ID = "EXECUTIVE_AUTO_APPROVE";
    public static final String AUTO_APPROVER_NAME = "System";

    private final List<String> executivePositions;

    public ApprovalStateMachine(List<String> executivePositions) {
        this.executivePositions = executivePositions == null
                ? List.of()
                : executivePositions.stream()
                        .filter(Objects::nonNull)
                        .map(keyword -> keyword.trim().toLowerCase(Locale.ROOT))
                        .filter(keyword -> !keyword.isEmpty())
                        .toList();
    }

    public TransitionResult submit(ReportLedgerEntry entry, SubmitRequest request, OffsetDateTime now) {
        ReportStatus from = entry.getStatus();
        if (from == ReportStatus.SUBMITTED) {
            return TransitionResult.unchanged(entry);
        }
        if (!from.isResubmittable()) {
            throw ProblemException.invalidTransition(
                    "Report %s cannot be submitted from %s".formatted(entry.getReportId(), from));
        }
        if (!request.hasUnderlyingData()) {
            throw ProblemException.invalidTransition(
                    "Report %s has no mileage, receipt or time entries".formatted(entry.getReportId()));
        }

        entry.markSubmitted(request.supervisorId(), now);

        if (isExecutive(request.employeePosition())) {
            entry.markReviewed(
                    ReportStatus.APPROVED,
                    AUTO_APPROVER_ID,
                    AUTO_APPROVER_NAME,
                    "Auto-approved for " + request.employeePosition().trim(),
                    now
            );
            NotificationDescriptor toEmployee = new NotificationDescriptor(
                    entry.getEmployeeId(),
                    RecipientRole.STAFF,
                    NotificationType.APPROVAL,
                    "Your report has been approved: " + entry.getComments(),
                    entry.getReportId(),
                    AUTO_APPROVER_ID,
                    AUTO_APPROVER_NAME
            );
            return new TransitionResult(entry, from, List.of(toEmployee), true);
        }

        List<NotificationDescriptor> notifications = new ArrayList<>();
        if (hasText(entry.getSupervisorId())) {
            String employeeName = hasText(request.employeeName()) ? request.employeeName() : entry.getEmployeeId();
            notifications.add(new NotificationDescriptor(
                    entry.getSupervisorId(),
                    RecipientRole.SUPERVISOR,
                    NotificationType.SUBMISSION,
                    "New report submitted for review by " + employeeName,
                    entry.getReportId(),
                    entry.getEmployeeId(),
                    request.employeeName()
            ));
        }
        return new TransitionResult(entry, from, List.copyOf(notifications), true);
    }

    public TransitionResult review(ReportLedgerEntry entry, ReviewRequest request, OffsetDateTime now) {
        ReportAction action = Objects.requireNonNull(request.action(), "action is required");
        if (action == ReportAction.SUBMIT) {
            throw new IllegalArgumentException("submit is not a review action");
        }

        ReportStatus from = entry.getStatus();
        if (from != ReportStatus.SUBMITTED) {
            throw ProblemException.invalidTransition(
                    "Report %s cannot be %s from %s".formatted(entry.getReportId(), pastTense(action), from));
        }

        String comments = trimToNull(request.comments());
        if (action != ReportAction.APPROVE && comments == null) {
            throw ProblemException.missingComment("A comment is required when a report is " + pastTense(action));
        }
        if (action == ReportAction.APPROVE && !mayApprove(entry, request)) {
            throw ProblemException.invalidTransition(
                    "Reviewer %s is not the assigned supervisor of report %s".formatted(
                            request.reviewerId(), entry.getReportId()));
        }

        ReportStatus outcome = switch (action) {
            case APPROVE -> ReportStatus.APPROVED;
            case REJECT -> ReportStatus.REJECTED;
            case REQUEST_REVISION -> ReportStatus.NEEDS_REVISION;
            case SUBMIT -> throw new IllegalStateException();
        };
        String reviewerName = hasText(request.reviewerName()) ? request.reviewerName() : request.reviewerId();
        entry.markReviewed(outcome, request.reviewerId(), reviewerName, comments, now);

        return new TransitionResult(entry, from, reviewNotifications(entry, action, reviewerName), true);
    }

    boolean isExecutive(String position) {
        if (!hasText(position)) {
            return false;
        }
        String normalized = position.toLowerCase(Locale.ROOT);
        return executivePositions.stream().anyMatch(normalized::contains);
    }

    private boolean mayApprove(ReportLedgerEntry entry, ReviewRequest request) {
        if (request.reviewerRole() == ReviewerRole.FINANCE) {
            return true;
        }
        return hasText(request.reviewerId()) && request.reviewerId().equals(entry.getSupervisorId());
    }

    private List<NotificationDescriptor> reviewNotifications(
            ReportLedgerEntry entry,
            ReportAction action,
            String reviewerName
    ) {
        NotificationType type;
        String message;
        switch (action) {
            case APPROVE -> {
                type = NotificationType.APPROVAL;
                message = entry.getComments() == null
                        ? "Your report has been approved"
                        : "Your report has been approved: " + entry.getComments();
            }
            case REJECT -> {
                type = NotificationType.REJECTION;
                message = "Your report was rejected: " + entry.getComments();
            }
            case REQUEST_REVISION -> {
                type = NotificationType.REVISION;
                message = "Your report needs revision: " + entry.getComments();
            }
            default -> throw new IllegalStateException("Unexpected review action " + action);
        }

        List<NotificationDescriptor> notifications = new ArrayList<>();
        notifications.add(new NotificationDescriptor(
                entry.getEmployeeId(),
                RecipientRole.STAFF,
                type,
                message,
                entry.getReportId(),
                entry.getReviewerId(),
                reviewerName
        ));

        String supervisorId = entry.getSupervisorId();
        if (hasText(supervisorId) && !supervisorId.equals(entry.getReviewerId())) {
            notifications.add(new NotificationDescriptor(
                    supervisorId,
                    RecipientRole.SUPERVISOR,
                    type,
                    "Report %s of %s was %s by %s".formatted(
                            entry.getReportId(), entry.getEmployeeId(), pastTense(action), reviewerName),
                    entry.getReportId(),
                    entry.getReviewerId(),
                    reviewerName
            ));
        }
        return List.copyOf(notifications);
    }

    private static String pastTense(ReportAction action) {
        return switch (action) {
            case APPROVE -> "approved";
            case REJECT -> "rejected";
            case REQUEST_REVISION -> "sent back for revision";
            case SUBMIT -> "submitted";
        };
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public record SubmitRequest(
            String supervisorId,
            String employeeName,
            String employeePosition,
            boolean hasUnderlyingData
    ) {
    }

    public record ReviewRequest(
            ReportAction action,
            String reviewerId,
            String reviewerName,
            ReviewerRole reviewerRole,
            String comments
    ) {
    }
}
