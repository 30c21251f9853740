package com.expenseflow.backend.modules.report;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import com.expenseflow.backend.modules.report.application.ReportApprovalService;
import com.expenseflow.backend.modules.report.domain.ReportLedgerEntry;
import com.expenseflow.backend.modules.report.domain.ReportStatus;
import com.expenseflow.backend.support.AbstractPostgresIntegrationTest;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

@SpringBootTest
@AutoConfigureMockMvc
class ReportApprovalIntegrationTest extends AbstractPostgresIntegrationTest {

    private static final String REPORT_ID = "emp-jane-2025-03";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private ReportApprovalService reportApprovalService;

    @BeforeEach
    void seedRoster() {
        jdbcTemplate.update("""
                INSERT INTO employee (id, email, name, position)
                VALUES ('sup-1', 'sam@example.org', 'Sam Supervisor', 'Program Lead')
                """);
        jdbcTemplate.update("""
                INSERT INTO employee (id, email, name, position, supervisor_id)
                VALUES ('emp-jane', 'jane@example.org', 'Jane Doe', 'Case Worker', 'sup-1')
                """);
        jdbcTemplate.update("""
                INSERT INTO mileage_entry (id, report_id, entry_date, miles, purpose)
                VALUES (gen_random_uuid(), ?, DATE '2025-03-04', 42.5, 'Home visit')
                """, REPORT_ID);
    }

    @Test
    void submitApproveAndReadNotifications() throws Exception {
        mockMvc.perform(post("/reports/submit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"reportId": "%s", "employeeId": "emp-jane"}
                                """.formatted(REPORT_ID)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("SUBMITTED"))
                .andExpect(jsonPath("$.supervisorId").value("sup-1"));

        mockMvc.perform(get("/reports/pending/{supervisorId}", "sup-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalCount").value(1))
                .andExpect(jsonPath("$.items[0].reportId").value(REPORT_ID));

        mockMvc.perform(get("/notifications/{employeeId}/count", "sup-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(1));

        mockMvc.perform(post("/reports/approve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"reportId": "%s", "reviewerId": "sup-1", "reviewerName": "Sam Supervisor"}
                                """.formatted(REPORT_ID)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("APPROVED"))
                .andExpect(jsonPath("$.reviewerName").value("Sam Supervisor"));

        mockMvc.perform(post("/reports/approve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"reportId": "%s", "reviewerId": "sup-1"}
                                """.formatted(REPORT_ID)))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("InvalidTransition"));

        mockMvc.perform(get("/reports/pending/{supervisorId}", "sup-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalCount").value(0));

        mockMvc.perform(get("/reports/history/{supervisorId}", "sup-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items[0].status").value("APPROVED"));

        mockMvc.perform(get("/reports/{reportId}/approval-history", REPORT_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items.length()").value(2))
                .andExpect(jsonPath("$.items[0].action").value("REPORT_APPROVE"))
                .andExpect(jsonPath("$.items[1].action").value("REPORT_SUBMIT"));

        MvcResult inbox = mockMvc.perform(get("/notifications/{employeeId}", "emp-jane"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.unreadCount").value(1))
                .andReturn();
        JsonNode items = objectMapper.readTree(inbox.getResponse().getContentAsString()).path("items");
        assertThat(items).hasSize(1);
        assertThat(items.get(0).path("message").asText()).startsWith("Your report has been approved");
        String notificationId = items.get(0).path("id").asText();

        mockMvc.perform(patch("/notifications/{notificationId}/read", notificationId))
                .andExpect(status().isOk());
        mockMvc.perform(patch("/notifications/{notificationId}/read", notificationId))
                .andExpect(status().isOk());

        mockMvc.perform(get("/notifications/{employeeId}/count", "emp-jane"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(0));
    }

    @Test
    void submitWithoutEntriesIsRejected() throws Exception {
        mockMvc.perform(post("/reports/submit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"reportId": "emp-jane-2025-04", "employeeId": "emp-jane"}
                                """))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("InvalidTransition"));

        mockMvc.perform(get("/reports/{reportId}", "emp-jane-2025-04"))
                .andExpect(status().isNotFound());
        assertThat(jdbcTemplate.queryForObject("SELECT COUNT(*) FROM notification", Integer.class)).isZero();
    }

    @Test
    void revisionRequiresCommentAndAllowsResubmission() throws Exception {
        mockMvc.perform(post("/reports/submit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"reportId": "%s", "employeeId": "emp-jane"}
                                """.formatted(REPORT_ID)))
                .andExpect(status().isOk());

        mockMvc.perform(post("/reports/request-revision")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"reportId": "%s", "reviewerId": "sup-1", "comments": "   "}
                                """.formatted(REPORT_ID)))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("MissingComment"));

        mockMvc.perform(post("/reports/request-revision")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"reportId": "%s", "reviewerId": "sup-1", "comments": "Add odometer photo"}
                                """.formatted(REPORT_ID)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("NEEDS_REVISION"))
                .andExpect(jsonPath("$.comments").value("Add odometer photo"));

        mockMvc.perform(post("/reports/submit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"reportId": "%s", "employeeId": "emp-jane"}
                                """.formatted(REPORT_ID)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("SUBMITTED"))
                .andExpect(jsonPath("$.reviewedAt").doesNotExist())
                .andExpect(jsonPath("$.comments").doesNotExist());
    }

    @Test
    void pendingQueueCoversIndirectReportsAndSurvivesSupervisorCycles() throws Exception {
        jdbcTemplate.update("""
                INSERT INTO employee (id, email, name, position, supervisor_id)
                VALUES ('mgr-2', 'mia@example.org', 'Mia Manager', 'Team Manager', 'sup-1')
                """);
        jdbcTemplate.update("""
                INSERT INTO employee (id, email, name, position, supervisor_id)
                VALUES ('emp-3', 'eli@example.org', 'Eli Field', 'Case Worker', 'mgr-2')
                """);
        jdbcTemplate.update("""
                INSERT INTO mileage_entry (id, report_id, entry_date, miles, purpose)
                VALUES (gen_random_uuid(), 'emp-3-2025-03', DATE '2025-03-11', 18.0, 'Site visit')
                """);

        mockMvc.perform(post("/reports/submit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"reportId": "emp-3-2025-03", "employeeId": "emp-3"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.supervisorId").value("mgr-2"));

        mockMvc.perform(get("/reports/pending/{supervisorId}", "mgr-2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalCount").value(1));
        mockMvc.perform(get("/reports/pending/{supervisorId}", "sup-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalCount").value(1))
                .andExpect(jsonPath("$.items[0].reportId").value("emp-3-2025-03"));
        mockMvc.perform(get("/reports/pending/{supervisorId}", "emp-3"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalCount").value(0));

        jdbcTemplate.update("UPDATE employee SET supervisor_id = 'emp-3' WHERE id = 'sup-1'");

        mockMvc.perform(get("/reports/pending/{supervisorId}", "sup-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalCount").value(1));
        mockMvc.perform(get("/reports/history/{supervisorId}", "emp-3"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items.length()").value(1));
    }

    @Test
    void overlappingFirstSubmitsCreateOneLedgerRow() throws Exception {
        CountDownLatch start = new CountDownLatch(1);
        Callable<ReportLedgerEntry> submit = () -> {
            start.await();
            return reportApprovalService.submitReportForApproval(REPORT_ID, "emp-jane", null);
        };
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<ReportLedgerEntry> first = executor.submit(submit);
            Future<ReportLedgerEntry> second = executor.submit(submit);
            start.countDown();

            assertThat(List.of(first.get(10, TimeUnit.SECONDS), second.get(10, TimeUnit.SECONDS)))
                    .extracting(ReportLedgerEntry::getStatus)
                    .containsOnly(ReportStatus.SUBMITTED);
        } finally {
            executor.shutdownNow();
        }

        assertThat(jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM report_ledger WHERE report_id = ?", Integer.class, REPORT_ID)).isEqualTo(1);
        assertThat(jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM audit_log WHERE action_type = 'REPORT_SUBMIT'", Integer.class)).isEqualTo(1);
        assertThat(jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM notification WHERE recipient_id = 'sup-1'", Integer.class)).isEqualTo(1);
    }
}
