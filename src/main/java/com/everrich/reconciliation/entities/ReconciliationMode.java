package com.everrich.reconciliation.entities;

/**
 * How a movement or expense is being reconciled.
 */
public enum ReconciliationMode {
    /**
     * Matched one-to-one (or not matched yet).
     */
    SIMPLE,

    /**
     * Fully covered by a split group.
     */
    SPLIT,

    /**
     * Participates in a split group that has not yet covered the full amount.
     */
    PARTIAL
}
