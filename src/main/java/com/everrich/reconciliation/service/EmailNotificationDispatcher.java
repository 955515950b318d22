package com.everrich.reconciliation.service;

import java.time.Clock;
import java.time.LocalDateTime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import com.everrich.reconciliation.entities.NotificationRequest;
import com.everrich.reconciliation.entities.NotificationStatus;
import com.everrich.reconciliation.entities.RecipientType;
import com.everrich.reconciliation.repository.NotificationRequestRepository;

/**
 * Sends queued case notifications by mail on the notification pool.
 * Recipients that are not e-mail addresses are handed to the log only.
 */
@Service
public class EmailNotificationDispatcher implements NotificationDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(EmailNotificationDispatcher.class);

    private final JavaMailSender mailSender;
    private final NotificationRequestRepository notificationRepository;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    @Value("${app.mail.from:noreply@everrich.app}")
    private String fromEmail;

    @Value("${app.mail.enabled:true}")
    private boolean emailEnabled;

    public EmailNotificationDispatcher(JavaMailSender mailSender,
                                       NotificationRequestRepository notificationRepository,
                                       TransactionTemplate transactionTemplate,
                                       Clock clock) {
        this.mailSender = mailSender;
        this.notificationRepository = notificationRepository;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
    }

    @Async("notificationExecutor")
    @Override
    public void dispatch(Long notificationId) {
        NotificationRequest request = notificationRepository.findById(notificationId).orElse(null);
        if (request == null) {
            logger.warn("Notification {} disappeared before delivery", notificationId);
            return;
        }
        if (request.getStatus() == NotificationStatus.SENT) {
            return;
        }

        String error = null;
        if (!emailEnabled || request.getRecipientType() != RecipientType.EMAIL) {
            logger.info("Notification {} ({}) for case {} to {} {} logged only: {}", notificationId,
                    request.getNotificationType(), request.getCaseId(), request.getRecipientType(),
                    request.getRecipientIdentifier(), request.getPayload());
        } else {
            try {
                SimpleMailMessage message = new SimpleMailMessage();
                message.setFrom(fromEmail);
                message.setTo(request.getRecipientIdentifier());
                message.setSubject(subjectFor(request));
                message.setText(request.getPayload());
                mailSender.send(message);
                logger.info("Notification {} sent to {}", notificationId, request.getRecipientIdentifier());
            } catch (MailException e) {
                logger.error("Failed to send notification {} to {}", notificationId, request.getRecipientIdentifier(), e);
                error = e.getMessage();
            }
        }

        String failure = error;
        transactionTemplate.executeWithoutResult(status -> {
            NotificationRequest current = notificationRepository.findById(notificationId).orElseThrow();
            if (failure == null) {
                current.setStatus(NotificationStatus.SENT);
                current.setSentAt(LocalDateTime.now(clock));
                current.setErrorMessage(null);
            } else {
                current.setStatus(NotificationStatus.FAILED);
                current.setRetryCount(current.getRetryCount() + 1);
                current.setErrorMessage(failure);
            }
            notificationRepository.save(current);
        });
    }

    private String subjectFor(NotificationRequest request) {
        String template = request.getTemplateId() != null ? request.getTemplateId() : request.getNotificationType().name();
        return "[Reconciliation] " + template + " - case " + request.getCaseId();
    }
}
