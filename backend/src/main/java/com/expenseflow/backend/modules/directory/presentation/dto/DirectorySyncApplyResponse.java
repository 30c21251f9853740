package com.expenseflow.backend.modules.directory.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;

import com.expenseflow.backend.modules.directory.application.DirectorySyncService.SyncApplyResult;
import com.expenseflow.backend.modules.directory.application.DirectorySyncService.SyncItemError;

public record DirectorySyncApplyResponse(
        int created,
        int updated,
        int archived,
        int duplicatesRemoved,
        List<SyncItemError> errors,
        OffsetDateTime appliedAt
) {

    public static DirectorySyncApplyResponse from(SyncApplyResult result, OffsetDateTime appliedAt) {
        return new DirectorySyncApplyResponse(
                result.created(),
                result.updated(),
                result.archived(),
                result.duplicatesRemoved(),
                result.errors(),
                appliedAt
        );
    }
}
