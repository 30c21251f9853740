package com.expenseflow.backend.modules.directory.domain;

import java.util.List;

/**
 * One person from the HR roster after field mapping. {@code email} is already trimmed and lower-cased.
 */
public record ExternalEmployeeRecord(
        String email,
        String name,
        String position,
        List<String> costCenters
) {

    public ExternalEmployeeRecord {
        costCenters = costCenters == null ? List.of() : List.copyOf(costCenters);
    }
}
