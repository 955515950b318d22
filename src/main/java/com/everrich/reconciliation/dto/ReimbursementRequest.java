package com.everrich.reconciliation.dto;

import com.everrich.reconciliation.entities.ReimbursementChannel;

/**
 * A repayment towards an advance. {@code movementId} is set when the money left
 * the company account as a bank movement.
 */
public record ReimbursementRequest(
        long amount,
        Long movementId,
        ReimbursementChannel channel,
        String operationId,
        String notes) {
}
