package com.expenseflow.backend.modules.directory.domain;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

import com.expenseflow.backend.modules.directory.domain.DirectoryChangePlan.Archive;
import com.expenseflow.backend.modules.directory.domain.DirectoryChangePlan.Create;
import com.expenseflow.backend.modules.directory.domain.DirectoryChangePlan.DuplicateCandidate;
import com.expenseflow.backend.modules.directory.domain.DirectoryChangePlan.Previous;
import com.expenseflow.backend.modules.directory.domain.DirectoryChangePlan.Update;

/**
 * Diffs the local roster against the HR roster, matching on normalized email.
 *
 * <p>Archived local records never take part in matching. When several active local records share an
 * email the earliest created one (then the smallest id) is matched and the others are reported as
 * duplicates. The result depends only on the two inputs and is sorted, so two runs over the same
 * data produce equal plans.</p>
 */
public class DirectoryReconciler {

    private static final Comparator<LocalEmployeeSnapshot> OLDEST_FIRST = Comparator
            .comparing(LocalEmployeeSnapshot::createdAt, Comparator.nullsLast(Comparator.<OffsetDateTime>naturalOrder()))
            .thenComparing(LocalEmployeeSnapshot::id);

    public DirectoryChangePlan reconcile(List<LocalEmployeeSnapshot> local, List<ExternalEmployeeRecord> external) {
        Map<String, List<LocalEmployeeSnapshot>> activeByEmail = new LinkedHashMap<>();
        for (LocalEmployeeSnapshot snapshot : local) {
            String email = normalizeEmail(snapshot.email());
            if (snapshot.archived() || email == null) {
                continue;
            }
            activeByEmail.computeIfAbsent(email, key -> new ArrayList<>()).add(snapshot);
        }

        Map<String, LocalEmployeeSnapshot> keptByEmail = new LinkedHashMap<>();
        List<DuplicateCandidate> duplicates = new ArrayList<>();
        activeByEmail.forEach((email, group) -> {
            List<LocalEmployeeSnapshot> ordered = group.stream().sorted(OLDEST_FIRST).toList();
            LocalEmployeeSnapshot kept = ordered.get(0);
            keptByEmail.put(email, kept);
            for (LocalEmployeeSnapshot redundant : ordered.subList(1, ordered.size())) {
                duplicates.add(new DuplicateCandidate(redundant.id(), redundant.name(), email, kept.id()));
            }
        });

        Map<String, ExternalEmployeeRecord> externalByEmail = mergeExternal(external);

        List<Create> creates = new ArrayList<>();
        List<Update> updates = new ArrayList<>();
        externalByEmail.forEach((email, record) -> {
            LocalEmployeeSnapshot match = keptByEmail.get(email);
            List<String> costCenters = sortedCostCenters(record.costCenters());
            if (match == null) {
                creates.add(new Create(email, record.name(), record.position(), costCenters));
            } else if (differs(match, record)) {
                updates.add(new Update(
                        email,
                        record.name(),
                        record.position(),
                        costCenters,
                        new Previous(match.id(), match.name(), match.position(), sortedCostCenters(match.costCenters()))
                ));
            }
        });

        List<Archive> archives = new ArrayList<>();
        keptByEmail.forEach((email, kept) -> {
            if (!externalByEmail.containsKey(email)) {
                archives.add(new Archive(kept.id(), kept.name(), email));
            }
        });

        creates.sort(Comparator.comparing(Create::email));
        updates.sort(Comparator.comparing(Update::email));
        archives.sort(Comparator.comparing(Archive::email).thenComparing(Archive::id));
        duplicates.sort(Comparator.comparing(DuplicateCandidate::email).thenComparing(DuplicateCandidate::id));
        return new DirectoryChangePlan(creates, updates, archives, duplicates);
    }

    /**
     * Collapses repeated emails: the first record's fields win and cost centers are unioned.
     */
    private Map<String, ExternalEmployeeRecord> mergeExternal(List<ExternalEmployeeRecord> external) {
        Map<String, ExternalEmployeeRecord> merged = new LinkedHashMap<>();
        for (ExternalEmployeeRecord record : external) {
            String email = normalizeEmail(record.email());
            if (email == null) {
                continue;
            }
            ExternalEmployeeRecord existing = merged.get(email);
            if (existing == null) {
                merged.put(email, new ExternalEmployeeRecord(email, record.name(), record.position(), record.costCenters()));
                continue;
            }
            Set<String> union = new LinkedHashSet<>(existing.costCenters());
            union.addAll(record.costCenters());
            merged.put(email, new ExternalEmployeeRecord(email, existing.name(), existing.position(), List.copyOf(union)));
        }
        return merged;
    }

    private boolean differs(LocalEmployeeSnapshot local, ExternalEmployeeRecord external) {
        return !Objects.equals(trim(local.name()), trim(external.name()))
                || !Objects.equals(trim(local.position()), trim(external.position()))
                || !normalizedCostCenters(local.costCenters()).equals(normalizedCostCenters(external.costCenters()));
    }

    static String normalizeEmail(String email) {
        if (email == null) {
            return null;
        }
        String normalized = email.trim().toLowerCase(Locale.ROOT);
        return normalized.isEmpty() ? null : normalized;
    }

    private static Set<String> normalizedCostCenters(Iterable<String> costCenters) {
        Set<String> normalized = new TreeSet<>();
        for (String costCenter : costCenters) {
            String value = trim(costCenter);
            if (value != null && !value.isEmpty()) {
                normalized.add(value);
            }
        }
        return normalized;
    }

    private static List<String> sortedCostCenters(Iterable<String> costCenters) {
        return List.copyOf(normalizedCostCenters(costCenters));
    }

    private static String trim(String value) {
        return value == null ? null : value.trim();
    }
}
