package com.expenseflow.backend.modules.report.domain;

public enum ReportAction {
    SUBMIT("REPORT_SUBMIT"),
    APPROVE("REPORT_APPROVE"),
    REJECT("REPORT_REJECT"),
    REQUEST_REVISION("REPORT_REQUEST_REVISION");

    private final String auditAction;

    ReportAction(String auditAction) {
        this.auditAction = auditAction;
    }

    public String auditAction() {
        return auditAction;
    }
}
