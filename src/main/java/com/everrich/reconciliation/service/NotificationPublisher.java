package com.everrich.reconciliation.service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import com.everrich.reconciliation.config.ReconciliationProperties;
import com.everrich.reconciliation.entities.NotificationRequest;
import com.everrich.reconciliation.entities.NotificationStatus;
import com.everrich.reconciliation.entities.NotificationType;
import com.everrich.reconciliation.entities.RecipientType;
import com.everrich.reconciliation.repository.NotificationRequestRepository;
import com.google.gson.Gson;

/**
 * Outbox for case notifications. A request is stored in the caller's transaction and
 * handed to the dispatcher only once that transaction has committed.
 */
@Service
public class NotificationPublisher {

    private static final Logger log = LoggerFactory.getLogger(NotificationPublisher.class);

    private final NotificationRequestRepository notificationRepository;
    private final NotificationDispatcher dispatcher;
    private final Gson gson;
    private final ReconciliationProperties properties;
    private final Clock clock;

    public NotificationPublisher(NotificationRequestRepository notificationRepository,
                                 NotificationDispatcher dispatcher,
                                 Gson gson,
                                 ReconciliationProperties properties,
                                 Clock clock) {
        this.notificationRepository = notificationRepository;
        this.dispatcher = dispatcher;
        this.gson = gson;
        this.properties = properties;
        this.clock = clock;
    }

    public NotificationRequest enqueue(Long caseId, NotificationType type, RecipientType recipientType,
                                       String recipient, String templateId, Map<String, Object> payload) {
        NotificationRequest request = new NotificationRequest(caseId, type, recipientType, recipient, templateId,
                gson.toJson(payload));
        request.setCreatedAt(LocalDateTime.now(clock));
        request = notificationRepository.save(request);
        Long id = request.getId();
        log.info("Queued {} notification {} for case {} to {} {}", type, id, caseId, recipientType, recipient);

        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    dispatcher.dispatch(id);
                }
            });
        } else {
            dispatcher.dispatch(id);
        }
        return request;
    }

    /**
     * Hands every failed notification that still has attempts left back to the dispatcher.
     *
     * @return number of notifications redispatched
     */
    public int redispatchFailed() {
        int maxAttempts = properties.getNotification().getMaxAttempts();
        List<Long> failed = notificationRepository.findRetryableIds(NotificationStatus.FAILED, maxAttempts);
        failed.forEach(dispatcher::dispatch);
        if (!failed.isEmpty()) {
            log.info("Redispatched {} failed notifications", failed.size());
        }
        return failed.size();
    }
}
