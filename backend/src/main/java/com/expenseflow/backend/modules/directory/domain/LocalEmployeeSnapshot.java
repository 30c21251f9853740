package com.expenseflow.backend.modules.directory.domain;

import java.time.OffsetDateTime;
import java.util.Set;

public record LocalEmployeeSnapshot(
        String id,
        String email,
        String name,
        String position,
        Set<String> costCenters,
        boolean archived,
        OffsetDateTime createdAt
) {

    public LocalEmployeeSnapshot {
        costCenters = costCenters == null ? Set.of() : Set.copyOf(costCenters);
    }
}
