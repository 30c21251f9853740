package com.expenseflow.backend.modules.report.domain;

import java.time.OffsetDateTime;

import com.expenseflow.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

/**
 * Durable approval status of one expense report. Mutated only by {@link ApprovalStateMachine}.
 */
@Entity
@Table(
        name = "report_ledger",
        indexes = {
                @Index(name = "idx_report_ledger_employee", columnList = "employee_id"),
                @Index(name = "idx_report_ledger_status", columnList = "status")
        }
)
public class ReportLedgerEntry extends AbstractTimestampedEntity {

    @Id
    @Column(name = "report_id", nullable = false, updatable = false, length = 128)
    private String reportId;

    @Column(name = "employee_id", nullable = false, length = 64)
    private String employeeId;

    @Column(name = "supervisor_id", length = 64)
    private String supervisorId;

    @Column(name = "reviewer_id", length = 64)
    private String reviewerId;

    @Column(name = "reviewer_name", length = 200)
    private String reviewerName;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private ReportStatus status = ReportStatus.DRAFT;

    @Column(name = "submitted_at")
    private OffsetDateTime submittedAt;

    @Column(name = "reviewed_at")
    private OffsetDateTime reviewedAt;

    @Column(name = "comments", columnDefinition = "text")
    private String comments;

    protected ReportLedgerEntry() {
    }

    public static ReportLedgerEntry draft(String reportId, String employeeId) {
        ReportLedgerEntry entry = new ReportLedgerEntry();
        entry.reportId = reportId;
        entry.employeeId = employeeId;
        entry.status = ReportStatus.DRAFT;
        return entry;
    }

    void markSubmitted(String supervisorId, OffsetDateTime now) {
        this.supervisorId = supervisorId;
        this.status = ReportStatus.SUBMITTED;
        this.submittedAt = now;
        this.reviewedAt = null;
        this.reviewerId = null;
        this.reviewerName = null;
        this.comments = null;
    }

    void markReviewed(ReportStatus outcome, String reviewerId, String reviewerName, String comments, OffsetDateTime now) {
        this.status = outcome;
        this.reviewerId = reviewerId;
        this.reviewerName = reviewerName;
        this.comments = comments;
        this.reviewedAt = now;
    }

    public String getReportId() {
        return reportId;
    }

    public String getEmployeeId() {
        return employeeId;
    }

    public String getSupervisorId() {
        return supervisorId;
    }

    public String getReviewerId() {
        return reviewerId;
    }

    public String getReviewerName() {
        return reviewerName;
    }

    public ReportStatus getStatus() {
        return status;
    }

    public OffsetDateTime getSubmittedAt() {
        return submittedAt;
    }

    public OffsetDateTime getReviewedAt() {
        return reviewedAt;
    }

    public String getComments() {
        return comments;
    }
}
