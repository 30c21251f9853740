package com.expenseflow.backend.modules.report;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import com.expenseflow.backend.global.error.ProblemException;
import com.expenseflow.backend.modules.audit.application.AuditLogService;
import com.expenseflow.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.expenseflow.backend.modules.employee.domain.Employee;
import com.expenseflow.backend.modules.employee.infrastructure.persistence.EmployeeRepository;
import com.expenseflow.backend.modules.notification.application.NotificationService;
import com.expenseflow.backend.modules.notification.domain.Notification;
import com.expenseflow.backend.modules.notification.domain.NotificationDescriptor;
import com.expenseflow.backend.modules.notification.domain.NotificationType;
import com.expenseflow.backend.modules.notification.domain.RecipientRole;
import com.expenseflow.backend.modules.report.application.ReportApprovalService;
import com.expenseflow.backend.modules.report.domain.ApprovalStateMachine;
import com.expenseflow.backend.modules.report.domain.ReportLedgerEntry;
import com.expenseflow.backend.modules.report.domain.ReportStatus;
import com.expenseflow.backend.modules.report.domain.ReviewerRole;
import com.expenseflow.backend.modules.report.infrastructure.persistence.ReportDataSource;
import com.expenseflow.backend.modules.report.infrastructure.persistence.ReportDataSource.ReportContentCounts;
import com.expenseflow.backend.modules.report.infrastructure.persistence.ReportLedgerRepository;
import com.expenseflow.backend.support.TestProperties;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageRequest;

@ExtendWith(MockitoExtension.class)
class ReportApprovalServiceTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-03-05T12:00:00Z");
    private static final String REPORT_ID = "emp-1-2025-03";

    @Mock
    private ReportLedgerRepository reportLedgerRepository;

    @Mock
    private ReportDataSource reportDataSource;

    @Mock
    private EmployeeRepository employeeRepository;

    @Mock
    private NotificationService notificationService;

    @Mock
    private AuditLogService auditLogService;

    private ReportApprovalService reportApprovalService;
    private Employee employee;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW.toInstant(), ZoneOffset.UTC);
        reportApprovalService = new ReportApprovalService(
                reportLedgerRepository,
                reportDataSource,
                employeeRepository,
                notificationService,
                auditLogService,
                TestProperties.defaults(),
                clock
        );

        employee = new Employee("emp-1");
        employee.setEmail("jane@example.org");
        employee.setName("Jane Doe");
        employee.setPosition("Case Manager");
        employee.setSupervisorId("sup-1");
    }

    @Test
    @DisplayName("first submission creates the ledger entry and notifies the recorded supervisor")
    @SuppressWarnings("unchecked")
    void submitCreatesEntry() {
        when(employeeRepository.findById("emp-1")).thenReturn(Optional.of(employee));
        when(reportLedgerRepository.findByIdForUpdate(REPORT_ID)).thenReturn(Optional.of(draftEntry()));
        when(reportDataSource.countContent(REPORT_ID)).thenReturn(new ReportContentCounts(2, 0, 0));
        when(reportLedgerRepository.save(any(ReportLedgerEntry.class))).thenAnswer(invocation -> invocation.getArgument(0));

        ReportLedgerEntry entry = reportApprovalService.submitReportForApproval(REPORT_ID, "emp-1", null);

        assertThat(entry.getStatus()).isEqualTo(ReportStatus.SUBMITTED);
        assertThat(entry.getSupervisorId()).isEqualTo("sup-1");
        assertThat(entry.getSubmittedAt()).isEqualTo(NOW);

        ArgumentCaptor<List<NotificationDescriptor>> notifications = ArgumentCaptor.forClass(List.class);
        verify(notificationService).createAll(notifications.capture());
        assertThat(notifications.getValue()).singleElement().satisfies(descriptor -> {
            assertThat(descriptor.recipientId()).isEqualTo("sup-1");
            assertThat(descriptor.recipientRole()).isEqualTo(RecipientRole.SUPERVISOR);
            assertThat(descriptor.type()).isEqualTo(NotificationType.SUBMISSION);
        });

        ArgumentCaptor<AuditLogCommand> audit = ArgumentCaptor.forClass(AuditLogCommand.class);
        verify(auditLogService).record(audit.capture());
        assertThat(audit.getValue().actionType()).isEqualTo("REPORT_SUBMIT");
        assertThat(audit.getValue().resourceKey()).isEqualTo(REPORT_ID);
        assertThat(audit.getValue().detail()).containsEntry("from", "DRAFT").containsEntry("to", "SUBMITTED");
    }

    @Test
    @DisplayName("an explicit supervisor overrides the recorded one")
    void submitWithExplicitSupervisor() {
        when(employeeRepository.findById("emp-1")).thenReturn(Optional.of(employee));
        when(reportLedgerRepository.findByIdForUpdate(REPORT_ID)).thenReturn(Optional.of(draftEntry()));
        when(reportDataSource.countContent(REPORT_ID)).thenReturn(new ReportContentCounts(0, 1, 0));
        when(reportLedgerRepository.save(any(ReportLedgerEntry.class))).thenAnswer(invocation -> invocation.getArgument(0));

        ReportLedgerEntry entry = reportApprovalService.submitReportForApproval(REPORT_ID, "emp-1", "sup-2");

        assertThat(entry.getSupervisorId()).isEqualTo("sup-2");
    }

    @Test
    @DisplayName("submission without underlying data writes nothing")
    void submitWithoutDataWritesNothing() {
        when(employeeRepository.findById("emp-1")).thenReturn(Optional.of(employee));
        when(reportLedgerRepository.findByIdForUpdate(REPORT_ID)).thenReturn(Optional.of(draftEntry()));
        when(reportDataSource.countContent(REPORT_ID)).thenReturn(new ReportContentCounts(0, 0, 0));

        assertThatThrownBy(() -> reportApprovalService.submitReportForApproval(REPORT_ID, "emp-1", null))
                .isInstanceOf(ProblemException.class)
                .extracting(ex -> ((ProblemException) ex).getCode())
                .isEqualTo("InvalidTransition");

        verify(reportLedgerRepository, never()).save(any());
        verifyNoInteractions(notificationService, auditLogService);
    }

    @Test
    @DisplayName("repeating a submit does not write or notify again")
    void repeatedSubmitIsNoOp() {
        ReportLedgerEntry submitted = submittedEntry();
        when(employeeRepository.findById("emp-1")).thenReturn(Optional.of(employee));
        when(reportLedgerRepository.findByIdForUpdate(REPORT_ID)).thenReturn(Optional.of(submitted));
        when(reportDataSource.countContent(REPORT_ID)).thenReturn(new ReportContentCounts(1, 1, 1));

        ReportLedgerEntry entry = reportApprovalService.submitReportForApproval(REPORT_ID, "emp-1", null);

        assertThat(entry).isSameAs(submitted);
        verify(reportLedgerRepository, never()).save(any());
        verifyNoInteractions(notificationService, auditLogService);
    }

    @Test
    @DisplayName("a first submit that overlaps another creates the row only once and then sees it submitted")
    void overlappingFirstSubmitIsNoOp() {
        ReportLedgerEntry submittedByOther = submittedEntry();
        when(employeeRepository.findById("emp-1")).thenReturn(Optional.of(employee));
        when(reportLedgerRepository.insertDraftIfAbsent(REPORT_ID, "emp-1")).thenReturn(0);
        when(reportLedgerRepository.findByIdForUpdate(REPORT_ID)).thenReturn(Optional.of(submittedByOther));
        when(reportDataSource.countContent(REPORT_ID)).thenReturn(new ReportContentCounts(1, 0, 0));

        ReportLedgerEntry entry = reportApprovalService.submitReportForApproval(REPORT_ID, "emp-1", null);

        assertThat(entry.getStatus()).isEqualTo(ReportStatus.SUBMITTED);
        InOrder inOrder = inOrder(reportLedgerRepository);
        inOrder.verify(reportLedgerRepository).insertDraftIfAbsent(REPORT_ID, "emp-1");
        inOrder.verify(reportLedgerRepository).findByIdForUpdate(REPORT_ID);
        verify(reportLedgerRepository, never()).save(any());
        verifyNoInteractions(notificationService, auditLogService);
    }

    @Test
    @DisplayName("reject without a comment fails with MissingComment and writes nothing")
    void rejectWithoutComment() {
        when(reportLedgerRepository.findByIdForUpdate(REPORT_ID)).thenReturn(Optional.of(submittedEntry()));

        assertThatThrownBy(() -> reportApprovalService.rejectReport(
                REPORT_ID, "sup-1", "Sam", ReviewerRole.SUPERVISOR, " "))
                .isInstanceOf(ProblemException.class)
                .extracting(ex -> ((ProblemException) ex).getCode())
                .isEqualTo("MissingComment");

        verify(reportLedgerRepository, never()).save(any());
        verifyNoInteractions(notificationService, auditLogService);
    }

    @Test
    @DisplayName("approve stores reviewer and notifies the employee")
    @SuppressWarnings("unchecked")
    void approve() {
        when(reportLedgerRepository.findByIdForUpdate(REPORT_ID)).thenReturn(Optional.of(submittedEntry()));
        when(reportLedgerRepository.save(any(ReportLedgerEntry.class))).thenAnswer(invocation -> invocation.getArgument(0));

        ReportLedgerEntry entry = reportApprovalService.approveReport(
                REPORT_ID, "sup-1", "Sam Supervisor", ReviewerRole.SUPERVISOR, null);

        assertThat(entry.getStatus()).isEqualTo(ReportStatus.APPROVED);
        assertThat(entry.getReviewedAt()).isEqualTo(NOW);
        assertThat(entry.getReviewerName()).isEqualTo("Sam Supervisor");

        ArgumentCaptor<List<NotificationDescriptor>> notifications = ArgumentCaptor.forClass(List.class);
        verify(notificationService).createAll(notifications.capture());
        assertThat(notifications.getValue())
                .extracting(NotificationDescriptor::recipientId, NotificationDescriptor::message)
                .containsExactly(tuple("emp-1", "Your report has been approved"));
    }

    @Test
    @DisplayName("reviewing an unknown report fails with NotFound")
    void reviewUnknownReport() {
        when(reportLedgerRepository.findByIdForUpdate("missing")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> reportApprovalService.approveReport(
                "missing", "sup-1", null, ReviewerRole.SUPERVISOR, null))
                .isInstanceOf(ProblemException.class)
                .extracting(ex -> ((ProblemException) ex).getCode())
                .isEqualTo("NotFound");
    }

    @Test
    @DisplayName("direct messages require text and a known employee")
    void sendMessageValidation() {
        assertThatThrownBy(() -> reportApprovalService.sendMessageToStaff("emp-1", "sup-1", "Sam", "  "))
                .isInstanceOf(ProblemException.class)
                .extracting(ex -> ((ProblemException) ex).getCode())
                .isEqualTo("MissingComment");

        when(employeeRepository.findById("ghost")).thenReturn(Optional.empty());
        assertThatThrownBy(() -> reportApprovalService.sendMessageToStaff("ghost", "sup-1", "Sam", "Hello"))
                .isInstanceOf(ProblemException.class)
                .extracting(ex -> ((ProblemException) ex).getCode())
                .isEqualTo("NotFound");
        verifyNoInteractions(notificationService);
    }

    @Test
    @DisplayName("direct message becomes a DIRECT_MESSAGE notification for the employee")
    void sendMessage() {
        when(employeeRepository.findById("emp-1")).thenReturn(Optional.of(employee));
        when(notificationService.create(any(NotificationDescriptor.class))).thenReturn(new Notification());

        reportApprovalService.sendMessageToStaff("emp-1", "sup-1", "Sam", " Please add the 3/2 receipt ");

        ArgumentCaptor<NotificationDescriptor> captor = ArgumentCaptor.forClass(NotificationDescriptor.class);
        verify(notificationService).create(captor.capture());
        assertThat(captor.getValue().type()).isEqualTo(NotificationType.DIRECT_MESSAGE);
        assertThat(captor.getValue().recipientId()).isEqualTo("emp-1");
        assertThat(captor.getValue().message()).isEqualTo("Please add the 3/2 receipt");
        verify(auditLogService).record(any(AuditLogCommand.class));
    }

    @Test
    @DisplayName("history falls back to the configured page size")
    void historyDefaultLimit() {
        when(employeeRepository.findSupervisedEmployeeIds("sup-1")).thenReturn(List.of("emp-1", "emp-3"));
        when(reportLedgerRepository.findTeamHistory(eq(List.of("emp-1", "emp-3")), any(PageRequest.class)))
                .thenReturn(List.of());

        reportApprovalService.getReportHistory("sup-1", null);

        verify(reportLedgerRepository).findTeamHistory(List.of("emp-1", "emp-3"), PageRequest.of(0, 50));
    }

    @Test
    @DisplayName("pending reports cover the whole team returned by the supervisor walk")
    void pendingUsesWholeTeam() {
        ReportLedgerEntry submitted = submittedEntry();
        when(employeeRepository.findSupervisedEmployeeIds("sup-1")).thenReturn(List.of("mgr-2", "emp-1"));
        when(reportLedgerRepository.findTeamReportsByStatus(List.of("mgr-2", "emp-1"), ReportStatus.SUBMITTED))
                .thenReturn(List.of(submitted));

        assertThat(reportApprovalService.getPendingReports("sup-1")).containsExactly(submitted);
    }

    @Test
    @DisplayName("a supervisor without reports gets empty lists without querying the ledger")
    void emptyTeam() {
        when(employeeRepository.findSupervisedEmployeeIds("nobody")).thenReturn(List.of());

        assertThat(reportApprovalService.getPendingReports("nobody")).isEmpty();
        assertThat(reportApprovalService.getReportHistory("nobody", 10)).isEmpty();
        verify(reportLedgerRepository, never()).findTeamReportsByStatus(any(), any());
        verify(reportLedgerRepository, never()).findTeamHistory(any(), any());
    }

    @Test
    @DisplayName("approval history of an unknown report fails with NotFound")
    void approvalHistoryUnknownReport() {
        when(reportLedgerRepository.existsById("missing")).thenReturn(false);

        assertThatThrownBy(() -> reportApprovalService.getApprovalHistory("missing"))
                .isInstanceOf(ProblemException.class);
        verify(auditLogService, never()).findTrail(any(), any());
    }

    private static ReportLedgerEntry draftEntry() {
        return ReportLedgerEntry.draft(REPORT_ID, "emp-1");
    }

    private static ReportLedgerEntry submittedEntry() {
        ReportLedgerEntry entry = ReportLedgerEntry.draft(REPORT_ID, "emp-1");
        new ApprovalStateMachine(List.of()).submit(
                entry,
                new ApprovalStateMachine.SubmitRequest("sup-1", "Jane Doe", "Case Manager", true),
                NOW.minusDays(1)
        );
        return entry;
    }
}
