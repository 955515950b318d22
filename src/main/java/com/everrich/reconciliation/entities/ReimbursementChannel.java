package com.everrich.reconciliation.entities;

public enum ReimbursementChannel {
    TRANSFER,
    PAYROLL,
    CASH,
    PENDING
}
