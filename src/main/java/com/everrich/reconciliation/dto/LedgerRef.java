package com.everrich.reconciliation.dto;

import com.everrich.reconciliation.entities.LedgerRecordKind;

/**
 * Reference to an expense or a bank movement by id.
 */
public record LedgerRef(LedgerRecordKind kind, Long id) {

    public static LedgerRef expense(Long id) {
        return new LedgerRef(LedgerRecordKind.EXPENSE, id);
    }

    public static LedgerRef movement(Long id) {
        return new LedgerRef(LedgerRecordKind.MOVEMENT, id);
    }

    @Override
    public String toString() {
        return kind + ":" + id;
    }
}
