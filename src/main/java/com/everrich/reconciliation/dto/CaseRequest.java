package com.everrich.reconciliation.dto;

import com.everrich.reconciliation.entities.BusinessImpact;
import com.everrich.reconciliation.entities.ReasonCode;

/**
 * Opens a non-reconciliation case against exactly one of an expense or a movement.
 * Impact and priority are derived from the amount when left null.
 */
public record CaseRequest(
        String companyId,
        Long expenseId,
        Long movementId,
        long amount,
        ReasonCode reasonCode,
        String reasonDescription,
        BusinessImpact businessImpact,
        Integer resolutionPriority,
        String actor) {

    public CaseRequest withActor(String newActor) {
        return new CaseRequest(companyId, expenseId, movementId, amount, reasonCode, reasonDescription,
                businessImpact, resolutionPriority, newActor);
    }
}
