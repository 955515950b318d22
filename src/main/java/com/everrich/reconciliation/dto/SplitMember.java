package com.everrich.reconciliation.dto;

import java.math.BigDecimal;

/**
 * One member of a split proposal. Percentage is informational only.
 */
public record SplitMember(LedgerRef ref, long amount, BigDecimal percentage) {

    public SplitMember(LedgerRef ref, long amount) {
        this(ref, amount, null);
    }
}
