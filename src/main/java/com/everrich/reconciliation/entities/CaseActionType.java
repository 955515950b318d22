package com.everrich.reconciliation.entities;

public enum CaseActionType {
    CREATED,
    ESCALATED,
    RESOLVED,
    DISMISSED,
    STATUS_CHANGED,
    COMMENTED,
    WORKFLOW_ADVANCED
}
