package com.expenseflow.backend.modules.employee.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

import com.expenseflow.backend.global.error.ProblemException;
import com.expenseflow.backend.modules.audit.application.AuditLogService;
import com.expenseflow.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.expenseflow.backend.modules.employee.domain.Employee;
import com.expenseflow.backend.modules.employee.infrastructure.persistence.EmployeeRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class EmployeeService {

    private static final Logger log = LoggerFactory.getLogger(EmployeeService.class);

    private static final String ACTION_ARCHIVE = "EMPLOYEE_ARCHIVE";
    private static final String ACTION_RESTORE = "EMPLOYEE_RESTORE";

    private final EmployeeRepository employeeRepository;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public EmployeeService(EmployeeRepository employeeRepository, AuditLogService auditLogService, Clock clock) {
        this.employeeRepository = employeeRepository;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public List<Employee> listActive() {
        return employeeRepository.findByArchivedFalseOrderByNameAsc();
    }

    @Transactional(readOnly = true)
    public List<Employee> listArchived() {
        return employeeRepository.findByArchivedTrueOrderByNameAsc();
    }

    @Transactional(readOnly = true)
    public Employee get(String employeeId) {
        return employeeRepository.findById(employeeId)
                .orElseThrow(() -> ProblemException.notFound("Employee %s not found".formatted(employeeId)));
    }

    /**
     * Archiving an already archived employee returns it unchanged and writes no audit record.
     */
    public Employee archive(String employeeId, String actorId) {
        Employee employee = lockEmployee(employeeId);
        if (employee.isArchived()) {
            return employee;
        }
        employee.archive(OffsetDateTime.now(clock));
        employeeRepository.save(employee);
        auditLogService.record(new AuditLogCommand(
                ACTION_ARCHIVE,
                AuditLogService.RESOURCE_EMPLOYEE,
                employee.getId(),
                actorId,
                Map.of("email", employee.getEmail(), "source", "manual")
        ));
        log.info("Archived employee {} ({})", employee.getId(), employee.getEmail());
        return employee;
    }

    public Employee restore(String employeeId, String actorId) {
        Employee employee = lockEmployee(employeeId);
        if (!employee.isArchived()) {
            return employee;
        }
        employee.restore();
        employeeRepository.save(employee);
        auditLogService.record(new AuditLogCommand(
                ACTION_RESTORE,
                AuditLogService.RESOURCE_EMPLOYEE,
                employee.getId(),
                actorId,
                Map.of("email", employee.getEmail())
        ));
        log.info("Restored employee {} ({})", employee.getId(), employee.getEmail());
        return employee;
    }

    private Employee lockEmployee(String employeeId) {
        return employeeRepository.findByIdForUpdate(employeeId)
                .orElseThrow(() -> ProblemException.notFound("Employee %s not found".formatted(employeeId)));
    }
}
