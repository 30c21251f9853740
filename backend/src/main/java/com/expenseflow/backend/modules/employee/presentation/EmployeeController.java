package com.expenseflow.backend.modules.employee.presentation;

import java.util.List;

import com.expenseflow.backend.modules.employee.application.EmployeeService;
import com.expenseflow.backend.modules.employee.domain.Employee;
import com.expenseflow.backend.modules.employee.presentation.dto.EmployeeListResponse;
import com.expenseflow.backend.modules.employee.presentation.dto.EmployeeResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/employees")
@Tag(name = "Employees", description = "Local employee roster")
public class EmployeeController {

    static final String ACTOR_HEADER = "X-Actor-Id";

    private final EmployeeService employeeService;

    public EmployeeController(EmployeeService employeeService) {
        this.employeeService = employeeService;
    }

    @GetMapping
    @Operation(summary = "Active employees ordered by name")
    public ResponseEntity<EmployeeListResponse> listActive() {
        return ResponseEntity.ok(toList(employeeService.listActive()));
    }

    @GetMapping("/archived")
    @Operation(summary = "Archived employees ordered by name")
    public ResponseEntity<EmployeeListResponse> listArchived() {
        return ResponseEntity.ok(toList(employeeService.listArchived()));
    }

    @GetMapping("/{employeeId}")
    public ResponseEntity<EmployeeResponse> get(@PathVariable("employeeId") String employeeId) {
        return ResponseEntity.ok(EmployeeResponse.from(employeeService.get(employeeId)));
    }

    @PostMapping("/{employeeId}/archive")
    @Operation(summary = "Archive an employee")
    public ResponseEntity<EmployeeResponse> archive(
            @PathVariable("employeeId") String employeeId,
            @RequestHeader(name = ACTOR_HEADER, required = false) String actorId
    ) {
        return ResponseEntity.ok(EmployeeResponse.from(employeeService.archive(employeeId, actorId)));
    }

    @PostMapping("/{employeeId}/restore")
    @Operation(summary = "Restore an archived employee")
    public ResponseEntity<EmployeeResponse> restore(
            @PathVariable("employeeId") String employeeId,
            @RequestHeader(name = ACTOR_HEADER, required = false) String actorId
    ) {
        return ResponseEntity.ok(EmployeeResponse.from(employeeService.restore(employeeId, actorId)));
    }

    private EmployeeListResponse toList(List<Employee> employees) {
        List<EmployeeResponse> items = employees.stream().map(EmployeeResponse::from).toList();
        return new EmployeeListResponse(items, items.size());
    }
}
