package com.everrich.reconciliation.exception;

public class NotFoundException extends LedgerException {

    public NotFoundException(String recordType, Object id) {
        super(recordType + " " + id + " not found");
    }
}
