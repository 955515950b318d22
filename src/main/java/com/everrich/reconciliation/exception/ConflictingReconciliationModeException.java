package com.everrich.reconciliation.exception;

/**
 * An expense cannot be awaiting a bank match and awaiting advance reimbursement at the same time.
 */
public class ConflictingReconciliationModeException extends LedgerException {

    public ConflictingReconciliationModeException(String message) {
        super(message);
    }
}
