package com.everrich.reconciliation.entities;

import java.time.LocalDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Outbox row for a notification the dispatcher must deliver. The payload is a Gson
 * encoded map the ledger never reads back.
 */
@Getter
@Setter
@Entity
@Table(name = "NOTIFICATION_REQUEST", indexes = {
    @Index(name = "idx_notification_status", columnList = "status, created_at")
})
@NoArgsConstructor
public class NotificationRequest {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "case_id")
    private Long caseId;

    @Enumerated(EnumType.STRING)
    @Column(name = "notification_type", nullable = false)
    private NotificationType notificationType;

    @Enumerated(EnumType.STRING)
    @Column(name = "recipient_type", nullable = false)
    private RecipientType recipientType;

    @Column(name = "recipient_identifier", nullable = false)
    private String recipientIdentifier;

    @Column(name = "template_id", nullable = false)
    private String templateId;

    @Column(columnDefinition = "TEXT")
    private String payload;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private NotificationStatus status = NotificationStatus.PENDING;

    @Column(name = "retry_count", nullable = false)
    private int retryCount;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "sent_at")
    private LocalDateTime sentAt;

    public NotificationRequest(Long caseId, NotificationType notificationType, RecipientType recipientType,
                               String recipientIdentifier, String templateId, String payload) {
        this.caseId = caseId;
        this.notificationType = notificationType;
        this.recipientType = recipientType;
        this.recipientIdentifier = recipientIdentifier;
        this.templateId = templateId;
        this.payload = payload;
        this.createdAt = LocalDateTime.now();
    }
}
