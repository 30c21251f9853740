package com.expenseflow.backend.modules.employee.presentation.dto;

import java.util.List;

public record EmployeeListResponse(
        List<EmployeeResponse> items,
        int totalCount
) {
}
