package com.expenseflow.backend.modules.report.presentation;

import com.expenseflow.backend.modules.notification.presentation.dto.NotificationItemResponse;
import com.expenseflow.backend.modules.report.application.ReportApprovalService;
import com.expenseflow.backend.modules.report.presentation.dto.SendMessageRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/messages")
@Tag(name = "Messages", description = "Direct messages from supervisors to staff")
public class MessageController {

    private final ReportApprovalService reportApprovalService;

    public MessageController(ReportApprovalService reportApprovalService) {
        this.reportApprovalService = reportApprovalService;
    }

    @PostMapping("/send")
    @Operation(summary = "Send a direct message to an employee's notification inbox")
    public ResponseEntity<NotificationItemResponse> send(@Valid @RequestBody SendMessageRequest request) {
        NotificationItemResponse response = NotificationItemResponse.from(reportApprovalService.sendMessageToStaff(
                request.employeeId(),
                request.supervisorId(),
                request.supervisorName(),
                request.message()
        ));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }
}
