package com.expenseflow.backend.modules.notification.presentation;

import java.util.List;
import java.util.UUID;

import com.expenseflow.backend.modules.notification.application.NotificationService;
import com.expenseflow.backend.modules.notification.presentation.dto.MarkAllReadResponse;
import com.expenseflow.backend.modules.notification.presentation.dto.NotificationItemResponse;
import com.expenseflow.backend.modules.notification.presentation.dto.NotificationListResponse;
import com.expenseflow.backend.modules.notification.presentation.dto.UnreadCountResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/notifications")
@Tag(name = "Notifications", description = "Per-recipient notification inbox")
public class NotificationController {

    private final NotificationService notificationService;

    public NotificationController(NotificationService notificationService) {
        this.notificationService = notificationService;
    }

    @GetMapping("/{employeeId}/count")
    @Operation(summary = "Unread notification count, polled by open sessions")
    public ResponseEntity<UnreadCountResponse> countUnread(@PathVariable("employeeId") String employeeId) {
        return ResponseEntity.ok(new UnreadCountResponse(notificationService.countUnread(employeeId)));
    }

    @GetMapping("/{employeeId}")
    @Operation(summary = "All notifications of a recipient, newest first")
    public ResponseEntity<NotificationListResponse> list(@PathVariable("employeeId") String employeeId) {
        List<NotificationItemResponse> items = notificationService.listForRecipient(employeeId).stream()
                .map(NotificationItemResponse::from)
                .toList();
        long unread = items.stream().filter(item -> !item.isRead()).count();
        return ResponseEntity.ok(new NotificationListResponse(items, unread));
    }

    @PatchMapping("/{notificationId}/read")
    @Operation(summary = "Mark one notification as read")
    public ResponseEntity<NotificationItemResponse> markRead(@PathVariable("notificationId") UUID notificationId) {
        return ResponseEntity.ok(NotificationItemResponse.from(notificationService.markRead(notificationId)));
    }

    @PatchMapping("/{employeeId}/read-all")
    @Operation(summary = "Mark every unread notification of a recipient as read")
    public ResponseEntity<MarkAllReadResponse> markAllRead(@PathVariable("employeeId") String employeeId) {
        return ResponseEntity.ok(new MarkAllReadResponse(notificationService.markAllRead(employeeId)));
    }
}
