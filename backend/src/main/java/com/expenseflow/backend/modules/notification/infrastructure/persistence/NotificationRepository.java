package com.expenseflow.backend.modules.notification.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;

import com.expenseflow.backend.modules.notification.domain.Notification;

public interface NotificationRepository extends JpaRepository<Notification, UUID> {

    long countByRecipientIdAndReadFalse(String recipientId);

    List<Notification> findByRecipientIdOrderByCreatedAtDesc(String recipientId);

    List<Notification> findByRecipientIdAndReadFalse(String recipientId);
}
