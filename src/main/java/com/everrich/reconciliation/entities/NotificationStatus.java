package com.everrich.reconciliation.entities;

public enum NotificationStatus {
    PENDING,
    SENT,
    FAILED
}
