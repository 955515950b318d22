package com.everrich.reconciliation.service;

/**
 * Delivers a stored notification request. Implementations must not block the caller.
 */
public interface NotificationDispatcher {

    void dispatch(Long notificationId);
}
