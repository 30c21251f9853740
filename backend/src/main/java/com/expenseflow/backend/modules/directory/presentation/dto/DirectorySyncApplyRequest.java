package com.expenseflow.backend.modules.directory.presentation.dto;

import java.util.List;

/**
 * Approved items of a previewed plan. Omitted lists mean nothing of that kind is approved.
 */
public record DirectorySyncApplyRequest(
        List<String> toCreate,
        List<String> toUpdate,
        List<String> toArchive,
        List<String> toRemoveDuplicates
) {

    public List<String> toCreateOrEmpty() {
        return toCreate == null ? List.of() : toCreate;
    }

    public List<String> toUpdateOrEmpty() {
        return toUpdate == null ? List.of() : toUpdate;
    }

    public List<String> toArchiveOrEmpty() {
        return toArchive == null ? List.of() : toArchive;
    }

    public List<String> toRemoveDuplicatesOrEmpty() {
        return toRemoveDuplicates == null ? List.of() : toRemoveDuplicates;
    }
}
