package com.everrich.reconciliation.exception;

/**
 * The mutation would violate a derived-field invariant or a state-machine rule.
 */
public class InvalidStateException extends LedgerException {

    public InvalidStateException(String message) {
        super(message);
    }
}
