package com.everrich.reconciliation.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Background trigger for redelivering failed notifications.
 */
@Component
public class NotificationRetrier {

    private static final Logger log = LoggerFactory.getLogger(NotificationRetrier.class);

    private final NotificationPublisher notificationPublisher;

    public NotificationRetrier(NotificationPublisher notificationPublisher) {
        this.notificationPublisher = notificationPublisher;
    }

    @Scheduled(cron = "${reconciliation.notification.retry-cron:0 */15 * * * *}")
    public void retryFailed() {
        int redispatched = notificationPublisher.redispatchFailed();
        log.debug("Notification retry run handed {} requests to the dispatcher", redispatched);
    }
}
