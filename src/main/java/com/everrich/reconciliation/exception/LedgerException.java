package com.everrich.reconciliation.exception;

/**
 * Base of the ledger error taxonomy. Only {@link ConcurrencyConflictException} is retryable.
 */
public abstract class LedgerException extends RuntimeException {

    protected LedgerException(String message) {
        super(message);
    }

    protected LedgerException(String message, Throwable cause) {
        super(message, cause);
    }

    public boolean isRetryable() {
        return false;
    }
}
