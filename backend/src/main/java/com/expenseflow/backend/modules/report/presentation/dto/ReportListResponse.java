package com.expenseflow.backend.modules.report.presentation.dto;

import java.util.List;

public record ReportListResponse(
        List<ReportResponse> items,
        int totalCount
) {
}
