package com.everrich.reconciliation.exception;

import com.everrich.reconciliation.entities.LedgerRecordKind;

public class AlreadyAllocatedException extends LedgerException {

    public AlreadyAllocatedException(LedgerRecordKind kind, Long recordId, String otherGroupId) {
        super(kind + " " + recordId + " already belongs to open split group " + otherGroupId);
    }
}
