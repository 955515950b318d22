package com.everrich.reconciliation.entities;

public enum ReimbursementStatus {
    NOT_REQUIRED,
    PENDING,
    PARTIAL,
    COMPLETED
}
