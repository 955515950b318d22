package com.everrich.reconciliation.dto;

public enum SplitDecision {
    FINALIZE,
    REJECT
}
