package com.everrich.reconciliation.entities;

public enum RecipientType {
    USER,
    ROLE,
    EMAIL,
    WEBHOOK
}
