package com.everrich.reconciliation.entities;

/**
 * Repayment lifecycle of an employee advance.
 * PENDING -> PARTIAL -> COMPLETED, or PENDING/PARTIAL -> CANCELLED.
 */
public enum AdvanceStatus {
    PENDING,
    PARTIAL,
    COMPLETED,
    CANCELLED;

    public boolean isOpen() {
        return this == PENDING || this == PARTIAL;
    }

    public ReimbursementStatus toReimbursementStatus() {
        switch (this) {
            case PARTIAL:
                return ReimbursementStatus.PARTIAL;
            case COMPLETED:
                return ReimbursementStatus.COMPLETED;
            case CANCELLED:
                return ReimbursementStatus.NOT_REQUIRED;
            case PENDING:
            default:
                return ReimbursementStatus.PENDING;
        }
    }
}
