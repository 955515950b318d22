package com.everrich.reconciliation.entities;

public enum ReasonCategory {
    MISSING_DATA,
    FORMAT_MISMATCH,
    AMOUNT_DISCREPANCY,
    DATE_INCONSISTENCY,
    VENDOR_MISMATCH,
    DUPLICATE_SUSPECTED,
    SYSTEM_ERROR,
    MANUAL_REVIEW_REQUIRED,
    EXTERNAL_DEPENDENCY
}
