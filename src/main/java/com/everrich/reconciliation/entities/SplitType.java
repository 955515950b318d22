package com.everrich.reconciliation.entities;

/**
 * Direction of a split group. The "one" side is the anchor whose amount is the
 * group's target.
 */
public enum SplitType {
    /**
     * One movement funds many expenses. Anchor is the movement.
     */
    ONE_TO_MANY(LedgerRecordKind.MOVEMENT),

    /**
     * Many movements pay one expense. Anchor is the expense.
     */
    MANY_TO_ONE(LedgerRecordKind.EXPENSE);

    private final LedgerRecordKind anchorKind;

    SplitType(LedgerRecordKind anchorKind) {
        this.anchorKind = anchorKind;
    }

    public LedgerRecordKind anchorKind() {
        return anchorKind;
    }

    public LedgerRecordKind memberKind() {
        return anchorKind == LedgerRecordKind.MOVEMENT ? LedgerRecordKind.EXPENSE : LedgerRecordKind.MOVEMENT;
    }
}
