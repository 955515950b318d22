package com.everrich.reconciliation.entities;

/**
 * Sign convention of a bank movement. Debits are negative amounts (money leaving
 * the company account), credits are positive.
 */
public enum MovementDirection {
    DEBIT,
    CREDIT;

    public static MovementDirection of(long signedAmount) {
        return signedAmount < 0 ? DEBIT : CREDIT;
    }
}
