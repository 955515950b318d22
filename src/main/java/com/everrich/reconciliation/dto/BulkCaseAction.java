package com.everrich.reconciliation.dto;

public enum BulkCaseAction {
    RESOLVE,
    DISMISS,
    HOLD
}
