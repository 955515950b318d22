package com.everrich.reconciliation.dto;

import java.util.Map;

/**
 * Outcome of a bulk case action.
 *
 * @param failures reason per case id that was left unchanged
 */
public record BulkCaseReport(BulkCaseAction action, int requested, int succeeded, int failed,
                             Map<Long, String> failures) {
}
