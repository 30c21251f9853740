package com.expenseflow.backend.modules.directory.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

import com.expenseflow.backend.global.error.ErrorKind;
import com.expenseflow.backend.global.error.ProblemException;
import com.expenseflow.backend.modules.audit.application.AuditLogService;
import com.expenseflow.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.expenseflow.backend.modules.directory.domain.DirectoryChangePlan.Archive;
import com.expenseflow.backend.modules.directory.domain.DirectoryChangePlan.Create;
import com.expenseflow.backend.modules.directory.domain.DirectoryChangePlan.DuplicateCandidate;
import com.expenseflow.backend.modules.directory.domain.DirectoryChangePlan.Update;
import com.expenseflow.backend.modules.employee.domain.Employee;
import com.expenseflow.backend.modules.employee.domain.EmployeeIdGenerator;
import com.expenseflow.backend.modules.employee.infrastructure.persistence.EmployeeRepository;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Applies one approved sync item per call, each in its own transaction, so a failed item leaves the
 * items already applied in place.
 */
@Component
public class DirectorySyncItemWriter {

    static final String ACTION_CREATE = "EMPLOYEE_SYNC_CREATE";
    static final String ACTION_UPDATE = "EMPLOYEE_SYNC_UPDATE";
    static final String ACTION_ARCHIVE = "EMPLOYEE_SYNC_ARCHIVE";
    static final String ACTION_REMOVE_DUPLICATE = "EMPLOYEE_SYNC_REMOVE_DUPLICATE";

    private final EmployeeRepository employeeRepository;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public DirectorySyncItemWriter(EmployeeRepository employeeRepository, AuditLogService auditLogService, Clock clock) {
        this.employeeRepository = employeeRepository;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Employee create(Create item, String actorId) {
        if (!employeeRepository.findActiveByEmail(item.email()).isEmpty()) {
            throw stale("Employee with email %s already exists".formatted(item.email()));
        }
        Employee employee = new Employee(EmployeeIdGenerator.fromName(item.name()));
        employee.setEmail(item.email());
        employee.setName(item.name());
        employee.setPosition(item.position());
        employee.replaceCostCenters(new LinkedHashSet<>(item.costCenters()));
        Employee saved = employeeRepository.save(employee);

        auditLogService.record(new AuditLogCommand(
                ACTION_CREATE,
                AuditLogService.RESOURCE_EMPLOYEE,
                saved.getId(),
                actorId,
                fields(item.email(), item.name(), item.position(), item.costCenters())
        ));
        return saved;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Employee update(Update item, String actorId) {
        Employee employee = lockActive(item.previous().id());
        employee.setName(item.name());
        employee.setPosition(item.position());
        employee.replaceCostCenters(new LinkedHashSet<>(item.costCenters()));
        Employee saved = employeeRepository.save(employee);

        Map<String, Object> detail = fields(item.email(), item.name(), item.position(), item.costCenters());
        detail.put("previous", fields(
                item.email(),
                item.previous().name(),
                item.previous().position(),
                item.previous().costCenters()
        ));
        auditLogService.record(new AuditLogCommand(
                ACTION_UPDATE,
                AuditLogService.RESOURCE_EMPLOYEE,
                saved.getId(),
                actorId,
                detail
        ));
        return saved;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Employee archive(Archive item, String actorId) {
        Employee employee = lockActive(item.id());
        employee.archive(OffsetDateTime.now(clock));
        Employee saved = employeeRepository.save(employee);
        auditLogService.record(new AuditLogCommand(
                ACTION_ARCHIVE,
                AuditLogService.RESOURCE_EMPLOYEE,
                saved.getId(),
                actorId,
                Map.of("email", item.email(), "source", "directory-sync")
        ));
        return saved;
    }

    /**
     * Duplicates are archived rather than deleted so their reports keep a valid employee reference.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Employee removeDuplicate(DuplicateCandidate item, String actorId) {
        Employee employee = lockActive(item.id());
        employee.archive(OffsetDateTime.now(clock));
        Employee saved = employeeRepository.save(employee);
        auditLogService.record(new AuditLogCommand(
                ACTION_REMOVE_DUPLICATE,
                AuditLogService.RESOURCE_EMPLOYEE,
                saved.getId(),
                actorId,
                Map.of("email", item.email(), "keptId", item.keptId())
        ));
        return saved;
    }

    private Employee lockActive(String employeeId) {
        Employee employee = employeeRepository.findByIdForUpdate(employeeId)
                .orElseThrow(() -> stale("Employee %s no longer exists".formatted(employeeId)));
        if (employee.isArchived()) {
            throw stale("Employee %s is already archived".formatted(employeeId));
        }
        return employee;
    }

    private static ProblemException stale(String detail) {
        return new ProblemException(ErrorKind.STALE_CONFLICT, detail);
    }

    private static Map<String, Object> fields(String email, String name, String position, List<String> costCenters) {
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("email", email);
        detail.put("name", name);
        detail.put("position", position);
        detail.put("costCenters", costCenters);
        return detail;
    }
}
