package com.expenseflow.backend.modules.report.domain;

public enum ReportStatus {
    DRAFT,
    SUBMITTED,
    APPROVED,
    REJECTED,
    NEEDS_REVISION;

    public boolean isResubmittable() {
        return this == DRAFT || this == REJECTED || this == NEEDS_REVISION;
    }
}
