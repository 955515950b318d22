package com.everrich.reconciliation.dto;

import java.time.LocalDate;

/**
 * A bank movement as delivered by the statement importer. Negative amounts are debits.
 */
public record MovementRegistration(
        String companyId,
        long amount,
        String currency,
        LocalDate transactionDate,
        String description) {
}
