package com.everrich.reconciliation.exception;

public class InvalidSplitTypeException extends LedgerException {

    public InvalidSplitTypeException(String message) {
        super(message);
    }
}
