package com.expenseflow.backend.modules.report.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.expenseflow.backend.global.config.ExpenseFlowProperties;
import com.expenseflow.backend.global.error.ProblemException;
import com.expenseflow.backend.modules.audit.application.AuditLogService;
import com.expenseflow.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.expenseflow.backend.modules.audit.domain.AuditLog;
import com.expenseflow.backend.modules.employee.domain.Employee;
import com.expenseflow.backend.modules.employee.infrastructure.persistence.EmployeeRepository;
import com.expenseflow.backend.modules.notification.application.NotificationService;
import com.expenseflow.backend.modules.notification.domain.Notification;
import com.expenseflow.backend.modules.notification.domain.NotificationDescriptor;
import com.expenseflow.backend.modules.notification.domain.NotificationType;
import com.expenseflow.backend.modules.notification.domain.RecipientRole;
import com.expenseflow.backend.modules.report.domain.ApprovalStateMachine;
import com.expenseflow.backend.modules.report.domain.ApprovalStateMachine.ReviewRequest;
import com.expenseflow.backend.modules.report.domain.ApprovalStateMachine.SubmitRequest;
import com.expenseflow.backend.modules.report.domain.ReportAction;
import com.expenseflow.backend.modules.report.domain.ReportLedgerEntry;
import com.expenseflow.backend.modules.report.domain.ReportStatus;
import com.expenseflow.backend.modules.report.domain.ReviewerRole;
import com.expenseflow.backend.modules.report.domain.TransitionResult;
import com.expenseflow.backend.modules.report.infrastructure.persistence.ReportDataSource;
import com.expenseflow.backend.modules.report.infrastructure.persistence.ReportLedgerRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Entry point of the approval workflow. Every action locks the ledger row, runs the state machine
 * and stores the entry, its audit record and its notifications in one transaction.
 */
@Service
@Transactional
public class ReportApprovalService {

    private static final Logger log = LoggerFactory.getLogger(ReportApprovalService.class);

    private static final String ACTION_DIRECT_MESSAGE = "DIRECT_MESSAGE";

    private final ReportLedgerRepository reportLedgerRepository;
    private final ReportDataSource reportDataSource;
    private final EmployeeRepository employeeRepository;
    private final NotificationService notificationService;
    private final AuditLogService auditLogService;
    private final ExpenseFlowProperties properties;
    private final ApprovalStateMachine stateMachine;
    private final Clock clock;

    public ReportApprovalService(
            ReportLedgerRepository reportLedgerRepository,
            ReportDataSource reportDataSource,
            EmployeeRepository employeeRepository,
            NotificationService notificationService,
            AuditLogService auditLogService,
            ExpenseFlowProperties properties,
            Clock clock
    ) {
        this.reportLedgerRepository = reportLedgerRepository;
        this.reportDataSource = reportDataSource;
        this.employeeRepository = employeeRepository;
        this.notificationService = notificationService;
        this.auditLogService = auditLogService;
        this.properties = properties;
        this.stateMachine = new ApprovalStateMachine(properties.approval().executivePositions());
        this.clock = clock;
    }

    /**
     * Submits a report, creating its ledger entry on first submission. Submitting a report that is
     * already awaiting review returns it unchanged, including when two first submits overlap.
     *
     * @param supervisorId reviewer to assign; the employee's recorded supervisor when {@code null}
     */
    public ReportLedgerEntry submitReportForApproval(String reportId, String employeeId, String supervisorId) {
        Employee employee = employeeRepository.findById(employeeId)
                .orElseThrow(() -> ProblemException.notFound("Employee %s not found".formatted(employeeId)));

        reportLedgerRepository.insertDraftIfAbsent(reportId, employeeId);
        ReportLedgerEntry entry = reportLedgerRepository.findByIdForUpdate(reportId)
                .orElseThrow(() -> new IllegalStateException("Ledger row for report %s vanished".formatted(reportId)));
        if (!entry.getEmployeeId().equals(employeeId)) {
            throw ProblemException.invalidTransition(
                    "Report %s belongs to another employee".formatted(reportId));
        }

        String assignedSupervisor = hasText(supervisorId) ? supervisorId : employee.getSupervisorId();
        boolean hasUnderlyingData = !reportDataSource.countContent(reportId).isEmpty();
        SubmitRequest request = new SubmitRequest(
                assignedSupervisor,
                employee.getName(),
                employee.getPosition(),
                hasUnderlyingData
        );

        TransitionResult result = stateMachine.submit(entry, request, OffsetDateTime.now(clock));
        if (!result.changed()) {
            log.debug("Report {} already submitted, ignoring repeated submit", reportId);
            return entry;
        }
        return persist(result, ReportAction.SUBMIT, employeeId, null);
    }

    public ReportLedgerEntry approveReport(
            String reportId,
            String reviewerId,
            String reviewerName,
            ReviewerRole reviewerRole,
            String comments
    ) {
        return review(reportId, new ReviewRequest(ReportAction.APPROVE, reviewerId, reviewerName, reviewerRole, comments));
    }

    public ReportLedgerEntry rejectReport(
            String reportId,
            String reviewerId,
            String reviewerName,
            ReviewerRole reviewerRole,
            String comments
    ) {
        return review(reportId, new ReviewRequest(ReportAction.REJECT, reviewerId, reviewerName, reviewerRole, comments));
    }

    public ReportLedgerEntry requestRevision(
            String reportId,
            String reviewerId,
            String reviewerName,
            ReviewerRole reviewerRole,
            String comments
    ) {
        return review(reportId,
                new ReviewRequest(ReportAction.REQUEST_REVISION, reviewerId, reviewerName, reviewerRole, comments));
    }

    public Notification sendMessageToStaff(
            String employeeId,
            String supervisorId,
            String supervisorName,
            String message
    ) {
        if (!hasText(message)) {
            throw ProblemException.missingComment("Message must not be empty");
        }
        Employee employee = employeeRepository.findById(employeeId)
                .orElseThrow(() -> ProblemException.notFound("Employee %s not found".formatted(employeeId)));

        Notification notification = notificationService.create(new NotificationDescriptor(
                employee.getId(),
                RecipientRole.STAFF,
                NotificationType.DIRECT_MESSAGE,
                message.trim(),
                null,
                supervisorId,
                supervisorName
        ));
        auditLogService.record(new AuditLogCommand(
                ACTION_DIRECT_MESSAGE,
                AuditLogService.RESOURCE_EMPLOYEE,
                employee.getId(),
                supervisorId,
                Map.of("notificationId", notification.getId() == null ? "" : notification.getId().toString())
        ));
        log.info("Supervisor {} messaged employee {}", supervisorId, employee.getId());
        return notification;
    }

    @Transactional(readOnly = true)
    public ReportLedgerEntry getReport(String reportId) {
        return reportLedgerRepository.findById(reportId)
                .orElseThrow(() -> ProblemException.notFound("Report %s not found".formatted(reportId)));
    }

    /**
     * Submitted reports of everyone the supervisor oversees, directly or through other supervisors.
     */
    @Transactional(readOnly = true)
    public List<ReportLedgerEntry> getPendingReports(String supervisorId) {
        List<String> team = employeeRepository.findSupervisedEmployeeIds(supervisorId);
        if (team.isEmpty()) {
            return List.of();
        }
        return reportLedgerRepository.findTeamReportsByStatus(team, ReportStatus.SUBMITTED);
    }

    /**
     * @param limit maximum number of entries; the configured default when {@code null} or not positive
     */
    @Transactional(readOnly = true)
    public List<ReportLedgerEntry> getReportHistory(String supervisorId, Integer limit) {
        int pageSize = (limit == null || limit < 1) ? properties.approval().historyLimit() : limit;
        List<String> team = employeeRepository.findSupervisedEmployeeIds(supervisorId);
        if (team.isEmpty()) {
            return List.of();
        }
        return reportLedgerRepository.findTeamHistory(team, PageRequest.of(0, pageSize));
    }

    @Transactional(readOnly = true)
    public List<ReportLedgerEntry> getEmployeeReports(String employeeId) {
        return reportLedgerRepository.findByEmployeeIdOrderByUpdatedAtDesc(employeeId);
    }

    @Transactional(readOnly = true)
    public List<AuditLog> getApprovalHistory(String reportId) {
        if (!reportLedgerRepository.existsById(reportId)) {
            throw ProblemException.notFound("Report %s not found".formatted(reportId));
        }
        return auditLogService.findTrail(AuditLogService.RESOURCE_REPORT, reportId);
    }

    private ReportLedgerEntry review(String reportId, ReviewRequest request) {
        ReportLedgerEntry entry = reportLedgerRepository.findByIdForUpdate(reportId)
                .orElseThrow(() -> ProblemException.notFound("Report %s not found".formatted(reportId)));
        TransitionResult result = stateMachine.review(entry, request, OffsetDateTime.now(clock));
        return persist(result, request.action(), request.reviewerId(), request.reviewerRole());
    }

    private ReportLedgerEntry persist(
            TransitionResult result,
            ReportAction action,
            String actorId,
            ReviewerRole reviewerRole
    ) {
        ReportLedgerEntry saved = reportLedgerRepository.save(result.entry());

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("from", result.previousStatus().name());
        detail.put("to", saved.getStatus().name());
        if (saved.getSupervisorId() != null) {
            detail.put("supervisorId", saved.getSupervisorId());
        }
        if (saved.getReviewerId() != null) {
            detail.put("reviewerId", saved.getReviewerId());
            detail.put("reviewerName", saved.getReviewerName());
        }
        if (reviewerRole != null) {
            detail.put("reviewerRole", reviewerRole.name());
        }
        if (saved.getComments() != null) {
            detail.put("comments", saved.getComments());
        }
        detail.put("notified", result.notifications().stream().map(NotificationDescriptor::recipientId).toList());
        auditLogService.record(new AuditLogCommand(
                action.auditAction(),
                AuditLogService.RESOURCE_REPORT,
                saved.getReportId(),
                actorId,
                detail
        ));

        notificationService.createAll(result.notifications());
        log.info("Report {} moved {} -> {} by {}", saved.getReportId(), result.previousStatus(), saved.getStatus(), actorId);
        return saved;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
