package com.everrich.reconciliation.entities;

public enum NotificationType {
    ESCALATION_WARNING,
    ESCALATION_OCCURRED,
    RESOLUTION_REMINDER,
    STATUS_CHANGE,
    RESOLUTION_COMPLETED,
    MANUAL_REVIEW_REQUIRED
}
