package com.expenseflow.backend.modules.employee.infrastructure.persistence;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.expenseflow.backend.modules.employee.domain.Employee;

import jakarta.persistence.LockModeType;

public interface EmployeeRepository extends JpaRepository<Employee, String> {

    List<Employee> findByArchivedFalseOrderByNameAsc();

    List<Employee> findByArchivedTrueOrderByNameAsc();

    @Query("""
            select e
              from Employee e
             where e.archived = false
               and lower(trim(e.email)) = lower(trim(:email))
             order by e.createdAt asc, e.id asc
            """)
    List<Employee> findActiveByEmail(@Param("email") String email);

    /**
     * Direct and indirect reports of a supervisor. {@code UNION} discards ids already collected, so a
     * cycle in the supervisor chain still terminates.
     */
    @Query(value = """
            WITH RECURSIVE team (id) AS (
                SELECT e.id FROM employee e WHERE e.supervisor_id = :supervisorId
                UNION
                SELECT e.id FROM employee e JOIN team t ON e.supervisor_id = t.id
            )
            SELECT id FROM team
            """, nativeQuery = true)
    List<String> findSupervisedEmployeeIds(@Param("supervisorId") String supervisorId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select e from Employee e where e.id = :id")
    Optional<Employee> findByIdForUpdate(@Param("id") String id);
}
