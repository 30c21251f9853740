package com.expenseflow.backend.modules.employee.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;

import com.expenseflow.backend.modules.employee.domain.Employee;

public record EmployeeResponse(
        String id,
        String email,
        String name,
        String position,
        List<String> costCenters,
        String supervisorId,
        boolean archived,
        OffsetDateTime archivedAt,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static EmployeeResponse from(Employee employee) {
        return new EmployeeResponse(
                employee.getId(),
                employee.getEmail(),
                employee.getName(),
                employee.getPosition(),
                employee.getCostCenters().stream().sorted().toList(),
                employee.getSupervisorId(),
                employee.isArchived(),
                employee.getArchivedAt(),
                employee.getCreatedAt(),
                employee.getUpdatedAt()
        );
    }
}
