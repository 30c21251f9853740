package com.expenseflow.backend.modules.notification.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

import com.expenseflow.backend.global.config.ExpenseFlowProperties;
import com.expenseflow.backend.global.error.ProblemException;
import com.expenseflow.backend.global.error.RetryableProblemException;
import com.expenseflow.backend.modules.notification.domain.Notification;
import com.expenseflow.backend.modules.notification.domain.NotificationDescriptor;
import com.expenseflow.backend.modules.notification.infrastructure.persistence.NotificationRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Per-recipient inbox. Notifications are only ever created and marked read, never deleted.
 */
@Service
@Transactional
public class NotificationService {

    private static final Logger log = LoggerFactory.getLogger(NotificationService.class);

    private final NotificationRepository notificationRepository;
    private final ExpenseFlowProperties properties;
    private final Clock clock;

    public NotificationService(
            NotificationRepository notificationRepository,
            ExpenseFlowProperties properties,
            Clock clock
    ) {
        this.notificationRepository = notificationRepository;
        this.properties = properties;
        this.clock = clock;
    }

    public Notification create(NotificationDescriptor descriptor) {
        Objects.requireNonNull(descriptor.recipientId(), "recipientId is required");
        Objects.requireNonNull(descriptor.recipientRole(), "recipientRole is required");
        Objects.requireNonNull(descriptor.type(), "type is required");

        Notification notification = new Notification();
        notification.setRecipientId(descriptor.recipientId());
        notification.setRecipientRole(descriptor.recipientRole());
        notification.setType(descriptor.type());
        notification.setMessage(descriptor.message());
        notification.setReportId(descriptor.reportId());
        notification.setSenderId(descriptor.senderId());
        notification.setSenderName(descriptor.senderName());
        return notificationRepository.save(notification);
    }

    public List<Notification> createAll(List<NotificationDescriptor> descriptors) {
        return descriptors.stream()
                .map(this::create)
                .toList();
    }

    /**
     * Polled by every open session, so a transient storage hiccup is reported as retryable
     * instead of a hard failure.
     */
    @Transactional(readOnly = true)
    public long countUnread(String recipientId) {
        try {
            return notificationRepository.countByRecipientIdAndReadFalse(recipientId);
        } catch (TransientDataAccessException | DataAccessResourceFailureException ex) {
            log.warn("Unread count unavailable for recipient {}: {}", recipientId, ex.getMessage());
            throw RetryableProblemException.storageFailure(
                    "Notification count temporarily unavailable",
                    properties.storage().retryAfterSeconds()
            );
        }
    }

    @Transactional(readOnly = true)
    public List<Notification> listForRecipient(String recipientId) {
        return notificationRepository.findByRecipientIdOrderByCreatedAtDesc(recipientId);
    }

    public Notification markRead(UUID notificationId) {
        Notification notification = notificationRepository.findById(notificationId)
                .orElseThrow(() -> ProblemException.notFound("Notification %s not found".formatted(notificationId)));
        if (!notification.isRead()) {
            notification.markRead(OffsetDateTime.now(clock));
            notificationRepository.save(notification);
        }
        return notification;
    }

    public int markAllRead(String recipientId) {
        List<Notification> unread = notificationRepository.findByRecipientIdAndReadFalse(recipientId);
        if (unread.isEmpty()) {
            return 0;
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        unread.forEach(notification -> notification.markRead(now));
        notificationRepository.saveAll(unread);
        return unread.size();
    }
}
