package com.expenseflow.backend.modules.report.domain;

public enum ReviewerRole {
    SUPERVISOR,
    FINANCE,
    ADMIN
}
