package com.expenseflow.backend.modules.employee;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import com.expenseflow.backend.global.error.ErrorKind;
import com.expenseflow.backend.global.error.ProblemException;
import com.expenseflow.backend.modules.audit.application.AuditLogService;
import com.expenseflow.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.expenseflow.backend.modules.employee.application.EmployeeService;
import com.expenseflow.backend.modules.employee.domain.Employee;
import com.expenseflow.backend.modules.employee.infrastructure.persistence.EmployeeRepository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class EmployeeServiceTest {

    private static final Instant NOW = Instant.parse("2025-04-01T12:00:00Z");

    @Mock
    private EmployeeRepository employeeRepository;

    @Mock
    private AuditLogService auditLogService;

    private EmployeeService employeeService;

    @BeforeEach
    void setUp() {
        employeeService = new EmployeeService(employeeRepository, auditLogService, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("archive stamps the time and writes an audit record")
    void archive() {
        Employee employee = employee();
        when(employeeRepository.findByIdForUpdate("emp-1")).thenReturn(Optional.of(employee));

        Employee archived = employeeService.archive("emp-1", "admin-1");

        assertThat(archived.isArchived()).isTrue();
        assertThat(archived.getArchivedAt()).isEqualTo(OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC));
        ArgumentCaptor<AuditLogCommand> captor = ArgumentCaptor.forClass(AuditLogCommand.class);
        verify(auditLogService).record(captor.capture());
        assertThat(captor.getValue().actionType()).isEqualTo("EMPLOYEE_ARCHIVE");
        assertThat(captor.getValue().actorId()).isEqualTo("admin-1");
        assertThat(captor.getValue().detail()).containsEntry("email", "jane@example.org");
    }

    @Test
    @DisplayName("archiving twice is a no-op the second time")
    void archiveIdempotent() {
        Employee employee = employee();
        employee.archive(OffsetDateTime.parse("2025-01-01T00:00:00Z"));
        when(employeeRepository.findByIdForUpdate("emp-1")).thenReturn(Optional.of(employee));

        Employee result = employeeService.archive("emp-1", "admin-1");

        assertThat(result.getArchivedAt()).isEqualTo(OffsetDateTime.parse("2025-01-01T00:00:00Z"));
        verify(employeeRepository, never()).save(any());
        verify(auditLogService, never()).record(any());
    }

    @Test
    @DisplayName("restore clears the archive flag")
    void restore() {
        Employee employee = employee();
        employee.archive(OffsetDateTime.parse("2025-01-01T00:00:00Z"));
        when(employeeRepository.findByIdForUpdate("emp-1")).thenReturn(Optional.of(employee));

        Employee restored = employeeService.restore("emp-1", null);

        assertThat(restored.isArchived()).isFalse();
        assertThat(restored.getArchivedAt()).isNull();
        verify(employeeRepository).save(employee);
    }

    @Test
    @DisplayName("unknown employees answer NotFound")
    void unknownEmployee() {
        when(employeeRepository.findByIdForUpdate("missing")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> employeeService.archive("missing", null))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo(ErrorKind.NOT_FOUND.code()));
    }

    private static Employee employee() {
        Employee employee = new Employee("emp-1");
        employee.setEmail("jane@example.org");
        employee.setName("Jane Doe");
        employee.setPosition("Case Worker");
        return employee;
    }
}
