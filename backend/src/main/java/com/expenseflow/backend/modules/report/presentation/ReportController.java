package com.expenseflow.backend.modules.report.presentation;

import java.util.List;

import com.expenseflow.backend.modules.report.application.ReportApprovalService;
import com.expenseflow.backend.modules.report.domain.ReportLedgerEntry;
import com.expenseflow.backend.modules.report.presentation.dto.ApprovalHistoryResponse;
import com.expenseflow.backend.modules.report.presentation.dto.ApprovalHistoryResponse.ApprovalHistoryItem;
import com.expenseflow.backend.modules.report.presentation.dto.ReportListResponse;
import com.expenseflow.backend.modules.report.presentation.dto.ReportResponse;
import com.expenseflow.backend.modules.report.presentation.dto.ReviewReportRequest;
import com.expenseflow.backend.modules.report.presentation.dto.SubmitReportRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/reports")
@Tag(name = "Reports", description = "Expense report approval workflow")
public class ReportController {

    private final ReportApprovalService reportApprovalService;

    public ReportController(ReportApprovalService reportApprovalService) {
        this.reportApprovalService = reportApprovalService;
    }

    @PostMapping("/submit")
    @Operation(summary = "Submit a report for approval; repeated submits are ignored")
    public ResponseEntity<ReportResponse> submit(@Valid @RequestBody SubmitReportRequest request) {
        ReportLedgerEntry entry = reportApprovalService.submitReportForApproval(
                request.reportId(),
                request.employeeId(),
                request.supervisorId()
        );
        return ResponseEntity.ok(ReportResponse.from(entry));
    }

    @PostMapping("/approve")
    @Operation(summary = "Approve a submitted report")
    public ResponseEntity<ReportResponse> approve(@Valid @RequestBody ReviewReportRequest request) {
        ReportLedgerEntry entry = reportApprovalService.approveReport(
                request.reportId(),
                request.reviewerId(),
                request.reviewerName(),
                request.reviewerRoleOrDefault(),
                request.comments()
        );
        return ResponseEntity.ok(ReportResponse.from(entry));
    }

    @PostMapping("/reject")
    @Operation(summary = "Reject a submitted report; a comment is required")
    public ResponseEntity<ReportResponse> reject(@Valid @RequestBody ReviewReportRequest request) {
        ReportLedgerEntry entry = reportApprovalService.rejectReport(
                request.reportId(),
                request.reviewerId(),
                request.reviewerName(),
                request.reviewerRoleOrDefault(),
                request.comments()
        );
        return ResponseEntity.ok(ReportResponse.from(entry));
    }

    @PostMapping("/request-revision")
    @Operation(summary = "Send a submitted report back for revision; a comment is required")
    public ResponseEntity<ReportResponse> requestRevision(@Valid @RequestBody ReviewReportRequest request) {
        ReportLedgerEntry entry = reportApprovalService.requestRevision(
                request.reportId(),
                request.reviewerId(),
                request.reviewerName(),
                request.reviewerRoleOrDefault(),
                request.comments()
        );
        return ResponseEntity.ok(ReportResponse.from(entry));
    }

    @GetMapping("/{reportId}")
    public ResponseEntity<ReportResponse> get(@PathVariable("reportId") String reportId) {
        return ResponseEntity.ok(ReportResponse.from(reportApprovalService.getReport(reportId)));
    }

    @GetMapping("/pending/{supervisorId}")
    @Operation(summary = "Submitted reports of a supervisor's direct reports, oldest first")
    public ResponseEntity<ReportListResponse> pending(@PathVariable("supervisorId") String supervisorId) {
        return ResponseEntity.ok(toList(reportApprovalService.getPendingReports(supervisorId)));
    }

    @GetMapping("/history/{supervisorId}")
    @Operation(summary = "Submitted and reviewed reports of a supervisor's team, newest first")
    public ResponseEntity<ReportListResponse> history(
            @PathVariable("supervisorId") String supervisorId,
            @RequestParam(name = "limit", required = false) Integer limit
    ) {
        return ResponseEntity.ok(toList(reportApprovalService.getReportHistory(supervisorId, limit)));
    }

    @GetMapping("/employee/{employeeId}")
    public ResponseEntity<ReportListResponse> byEmployee(@PathVariable("employeeId") String employeeId) {
        return ResponseEntity.ok(toList(reportApprovalService.getEmployeeReports(employeeId)));
    }

    @GetMapping("/{reportId}/approval-history")
    @Operation(summary = "Audit trail of a report's transitions, newest first")
    public ResponseEntity<ApprovalHistoryResponse> approvalHistory(@PathVariable("reportId") String reportId) {
        List<ApprovalHistoryItem> items = reportApprovalService.getApprovalHistory(reportId).stream()
                .map(ApprovalHistoryItem::from)
                .toList();
        return ResponseEntity.ok(new ApprovalHistoryResponse(reportId, items));
    }

    private ReportListResponse toList(List<ReportLedgerEntry> entries) {
        List<ReportResponse> items = entries.stream().map(ReportResponse::from).toList();
        return new ReportListResponse(items, items.size());
    }
}
