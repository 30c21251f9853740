package com.expenseflow.backend.modules.report.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.expenseflow.backend.modules.report.domain.ReportLedgerEntry;
import com.expenseflow.backend.modules.report.domain.ReportStatus;

import jakarta.persistence.LockModeType;

public interface ReportLedgerRepository extends JpaRepository<ReportLedgerEntry, String> {

    /**
     * Creates the DRAFT row unless one exists. A concurrent first submit waits here for the other
     * transaction and then finds its row under the lock.
     */
    @Modifying
    @Query(value = """
            INSERT INTO report_ledger (report_id, employee_id, status, created_at, updated_at)
            VALUES (:reportId, :employeeId, 'DRAFT', CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)
            ON CONFLICT (report_id) DO NOTHING
            """, nativeQuery = true)
    int insertDraftIfAbsent(@Param("reportId") String reportId, @Param("employeeId") String employeeId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select r from ReportLedgerEntry r where r.reportId = :reportId")
    Optional<ReportLedgerEntry> findByIdForUpdate(@Param("reportId") String reportId);

    /**
     * Reports of the given team in one status, oldest submission first.
     */
    @Query("""
            select r
              from ReportLedgerEntry r
             where r.status = :status
               and r.employeeId in :employeeIds
             order by r.submittedAt asc, r.reportId asc
            """)
    List<ReportLedgerEntry> findTeamReportsByStatus(
            @Param("employeeIds") Collection<String> employeeIds,
            @Param("status") ReportStatus status
    );

    @Query("""
            select r
              from ReportLedgerEntry r
             where r.status <> com.expenseflow.backend.modules.report.domain.ReportStatus.DRAFT
               and r.employeeId in :employeeIds
             order by coalesce(r.reviewedAt, r.submittedAt) desc, r.reportId asc
            """)
    List<ReportLedgerEntry> findTeamHistory(@Param("employeeIds") Collection<String> employeeIds, Pageable pageable);

    List<ReportLedgerEntry> findByEmployeeIdOrderByUpdatedAtDesc(String employeeId);
}
