package com.expenseflow.backend.modules.directory.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;

import com.expenseflow.backend.modules.directory.domain.DirectoryChangePlan;

public record DirectorySyncPreviewResponse(
        List<DirectoryChangePlan.Create> creates,
        List<DirectoryChangePlan.Update> updates,
        List<DirectoryChangePlan.Archive> archives,
        List<DirectoryChangePlan.DuplicateCandidate> duplicatesRemoved,
        OffsetDateTime generatedAt
) {

    public static DirectorySyncPreviewResponse from(DirectoryChangePlan plan, OffsetDateTime generatedAt) {
        return new DirectorySyncPreviewResponse(
                plan.creates(),
                plan.updates(),
                plan.archives(),
                plan.duplicatesRemoved(),
                generatedAt
        );
    }
}
