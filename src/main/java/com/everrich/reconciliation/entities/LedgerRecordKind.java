package com.everrich.reconciliation.entities;

public enum LedgerRecordKind {
    EXPENSE,
    MOVEMENT,
    ADVANCE
}
