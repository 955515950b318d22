package com.everrich.reconciliation.entities;

public enum SplitGroupStatus {
    /**
     * Allocations committed but the target is not yet covered. Can be revised or rejected.
     */
    OPEN,

    /**
     * Allocated total equals the target. Immutable apart from audit annotations.
     */
    COMPLETE,

    /**
     * Rolled back. All member allocations were released.
     */
    REJECTED
}
