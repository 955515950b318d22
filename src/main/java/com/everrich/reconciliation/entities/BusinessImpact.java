package com.everrich.reconciliation.entities;

public enum BusinessImpact {
    LOW(4),
    MEDIUM(3),
    HIGH(2),
    CRITICAL(1);

    private final int defaultPriority;

    BusinessImpact(int defaultPriority) {
        this.defaultPriority = defaultPriority;
    }

    /**
     * Resolution priority tier (1 = highest, 4 = minimal) used when the caller gives none.
     */
    public int getDefaultPriority() {
        return defaultPriority;
    }
}
