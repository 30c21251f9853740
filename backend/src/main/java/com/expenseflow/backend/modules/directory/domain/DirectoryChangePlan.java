package com.expenseflow.backend.modules.directory.domain;

import java.util.List;

/**
 * Changes that would align the local roster with the HR roster. Computed on demand and never stored.
 */
public record DirectoryChangePlan(
        List<Create> creates,
        List<Update> updates,
        List<Archive> archives,
        List<DuplicateCandidate> duplicatesRemoved
) {

    public DirectoryChangePlan {
        creates = List.copyOf(creates);
        updates = List.copyOf(updates);
        archives = List.copyOf(archives);
        duplicatesRemoved = List.copyOf(duplicatesRemoved);
    }

    public boolean isEmpty() {
        return creates.isEmpty() && updates.isEmpty() && archives.isEmpty() && duplicatesRemoved.isEmpty();
    }

    public record Create(
            String email,
            String name,
            String position,
            List<String> costCenters
    ) {
    }

    public record Update(
            String email,
            String name,
            String position,
            List<String> costCenters,
            Previous previous
    ) {
    }

    public record Previous(
            String id,
            String name,
            String position,
            List<String> costCenters
    ) {
    }

    public record Archive(
            String id,
            String name,
            String email
    ) {
    }

    /**
     * Redundant active record sharing its email with {@code keptId}.
     */
    public record DuplicateCandidate(
            String id,
            String name,
            String email,
            String keptId
    ) {
    }
}
