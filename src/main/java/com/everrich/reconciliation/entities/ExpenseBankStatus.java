package com.everrich.reconciliation.entities;

/**
 * Bank-side reconciliation status of an expense.
 */
public enum ExpenseBankStatus {
    UNRECONCILED,
    PARTIALLY_RECONCILED,
    RECONCILED,

    /**
     * Paid personally by an employee, so it will never match a company bank movement.
     */
    NON_RECONCILABLE
}
