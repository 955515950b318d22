package com.everrich.reconciliation.exception;

/**
 * Optimistic version mismatch. Retry the whole operation with freshly read data.
 */
public class ConcurrencyConflictException extends LedgerException {

    public ConcurrencyConflictException(String message) {
        super(message);
    }

    public ConcurrencyConflictException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
