package com.expenseflow.backend.modules.directory.application;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

import com.expenseflow.backend.global.error.ErrorKind;
import com.expenseflow.backend.global.error.ProblemException;
import com.expenseflow.backend.modules.directory.domain.DirectoryChangePlan;
import com.expenseflow.backend.modules.directory.domain.DirectoryChangePlan.Archive;
import com.expenseflow.backend.modules.directory.domain.DirectoryChangePlan.Create;
import com.expenseflow.backend.modules.directory.domain.DirectoryChangePlan.DuplicateCandidate;
import com.expenseflow.backend.modules.directory.domain.DirectoryChangePlan.Update;
import com.expenseflow.backend.modules.directory.domain.DirectoryReconciler;
import com.expenseflow.backend.modules.directory.domain.ExternalEmployeeRecord;
import com.expenseflow.backend.modules.directory.domain.LocalEmployeeSnapshot;
import com.expenseflow.backend.modules.directory.infrastructure.ExternalDirectoryClient;
import com.expenseflow.backend.modules.employee.domain.Employee;
import com.expenseflow.backend.modules.employee.infrastructure.persistence.EmployeeRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

/**
 * Two-step HR roster sync: preview the change plan, then apply an approved subset of it.
 *
 * <p>Apply never trusts the plan the admin looked at. It recomputes the plan from fresh snapshots and
 * applies only approved items that are still part of it; the rest are reported as stale.</p>
 */
@Service
public class DirectorySyncService {

    private static final Logger log = LoggerFactory.getLogger(DirectorySyncService.class);

    private final ExternalDirectoryClient externalDirectoryClient;
    private final EmployeeRepository employeeRepository;
    private final DirectorySyncItemWriter itemWriter;
    private final DirectoryReconciler reconciler = new DirectoryReconciler();

    public DirectorySyncService(
            ExternalDirectoryClient externalDirectoryClient,
            EmployeeRepository employeeRepository,
            DirectorySyncItemWriter itemWriter
    ) {
        this.externalDirectoryClient = externalDirectoryClient;
        this.employeeRepository = employeeRepository;
        this.itemWriter = itemWriter;
    }

    public DirectoryChangePlan previewSync() {
        DirectoryChangePlan plan = computePlan();
        log.info("Directory sync preview: {} creates, {} updates, {} archives, {} duplicates",
                plan.creates().size(), plan.updates().size(), plan.archives().size(), plan.duplicatesRemoved().size());
        return plan;
    }

    public SyncApplyResult applySync(SyncApplyCommand command) {
        DirectoryChangePlan plan = computePlan();
        List<SyncItemError> errors = new ArrayList<>();

        Map<String, DuplicateCandidate> duplicates = index(plan.duplicatesRemoved(), DuplicateCandidate::id);
        int duplicatesRemoved = applyItems("toRemoveDuplicates", command.toRemoveDuplicates(), String::trim,
                duplicates, item -> itemWriter.removeDuplicate(item, command.actorId()), errors);

        Map<String, Update> updates = index(plan.updates(), Update::email);
        int updated = applyItems("toUpdate", command.toUpdate(), DirectorySyncService::normalizeEmail,
                updates, item -> itemWriter.update(item, command.actorId()), errors);

        Map<String, Create> creates = index(plan.creates(), Create::email);
        int created = applyItems("toCreate", command.toCreate(), DirectorySyncService::normalizeEmail,
                creates, item -> itemWriter.create(item, command.actorId()), errors);

        Map<String, Archive> archives = index(plan.archives(), Archive::id);
        int archived = applyItems("toArchive", command.toArchive(), String::trim,
                archives, item -> itemWriter.archive(item, command.actorId()), errors);

        log.info("Directory sync applied: {} created, {} updated, {} archived, {} duplicates removed, {} errors",
                created, updated, archived, duplicatesRemoved, errors.size());
        return new SyncApplyResult(created, updated, archived, duplicatesRemoved, List.copyOf(errors));
    }

    private DirectoryChangePlan computePlan() {
        List<ExternalEmployeeRecord> external = externalDirectoryClient.fetchRoster();
        List<LocalEmployeeSnapshot> local = employeeRepository.findAll().stream()
                .map(DirectorySyncService::toSnapshot)
                .toList();
        return reconciler.reconcile(local, external);
    }

    private <T> int applyItems(
            String field,
            Collection<String> approved,
            Function<String, String> keyNormalizer,
            Map<String, T> planned,
            Function<T, Employee> writer,
            List<SyncItemError> errors
    ) {
        if (approved == null || approved.isEmpty()) {
            return 0;
        }
        Set<String> keys = new LinkedHashSet<>();
        approved.stream()
                .filter(key -> key != null && !key.isBlank())
                .map(keyNormalizer)
                .forEach(keys::add);

        int applied = 0;
        for (String key : keys) {
            String target = field + ":" + key;
            T item = planned.get(key);
            if (item == null) {
                errors.add(new SyncItemError(ErrorKind.STALE_CONFLICT.code(), target,
                        "Item is no longer part of the current sync plan"));
                continue;
            }
            try {
                writer.apply(item);
                applied++;
            } catch (ProblemException ex) {
                log.warn("Directory sync item {} rejected: {}", target, ex.getDetailMessage());
                errors.add(new SyncItemError(ex.getCode(), target, ex.getDetailMessage()));
            } catch (DataAccessException | TransactionException ex) {
                log.warn("Directory sync item {} failed to persist: {}", target, ex.getMessage());
                errors.add(new SyncItemError(ErrorKind.STORAGE_FAILURE.code(), target, "Failed to persist change"));
            } catch (RuntimeException ex) {
                log.warn("Directory sync item {} failed unexpectedly", target, ex);
                errors.add(new SyncItemError("internal_error", target, "Unexpected failure while applying change"));
            }
        }
        return applied;
    }

    private static <T> Map<String, T> index(List<T> items, Function<T, String> key) {
        Map<String, T> indexed = new LinkedHashMap<>();
        items.forEach(item -> indexed.putIfAbsent(key.apply(item), item));
        return indexed;
    }

    private static LocalEmployeeSnapshot toSnapshot(Employee employee) {
        return new LocalEmployeeSnapshot(
                employee.getId(),
                employee.getEmail(),
                employee.getName(),
                employee.getPosition(),
                Set.copyOf(employee.getCostCenters()),
                employee.isArchived(),
                employee.getCreatedAt()
        );
    }

    private static String normalizeEmail(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Approved subset of a previewed plan. Emails identify creates and updates; ids identify archives
     * and duplicates.
     */
    public record SyncApplyCommand(
            Collection<String> toCreate,
            Collection<String> toUpdate,
            Collection<String> toArchive,
            Collection<String> toRemoveDuplicates,
            String actorId
    ) {
    }

    public record SyncApplyResult(
            int created,
            int updated,
            int archived,
            int duplicatesRemoved,
            List<SyncItemError> errors
    ) {
    }

    public record SyncItemError(
            String kind,
            String target,
            String detail
    ) {
    }
}
