package com.everrich.reconciliation.dto;

import java.util.List;

/**
 * One action applied to many cases. Each case is handled on its own.
 */
public record BulkCaseRequest(List<Long> caseIds, BulkCaseAction action, String notes, String actor) {

    public BulkCaseRequest withActor(String newActor) {
        return new BulkCaseRequest(caseIds, action, notes, newActor);
    }
}
